package ai.docsite.reviewer.filter;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shell-style glob compiled to a regular expression.
 *
 * <p>{@code *} matches any run of characters including {@code /}, {@code ?} matches one character,
 * {@code [abc]} and {@code [!abc]} match character sets. An unterminated {@code [} is literal.
 * A glob that cannot be compiled never matches.
 */
public final class GlobPattern {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobPattern.class);

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        try {
            return new GlobPattern(glob, Pattern.compile(toRegex(glob), Pattern.DOTALL));
        } catch (PatternSyntaxException ex) {
            LOGGER.warn("Path filter '{}' is not a valid glob and will never match", glob);
            return new GlobPattern(glob, null);
        }
    }

    public static boolean hasMetacharacters(String glob) {
        return glob.indexOf('*') >= 0 || glob.indexOf('?') >= 0 || glob.indexOf('[') >= 0;
    }

    public boolean matches(String path) {
        return pattern != null && pattern.matcher(path).matches();
    }

    public boolean isValid() {
        return pattern != null;
    }

    public String glob() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int length = glob.length();
        int i = 0;
        while (i < length) {
            char ch = glob.charAt(i++);
            switch (ch) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int end = findClassEnd(glob, i);
                    if (end < 0) {
                        regex.append("\\[");
                    } else {
                        regex.append(characterClass(glob.substring(i, end)));
                        i = end + 1;
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(ch)));
            }
        }
        return regex.toString();
    }

    private static int findClassEnd(String glob, int start) {
        int j = start;
        if (j < glob.length() && glob.charAt(j) == '!') {
            j++;
        }
        if (j < glob.length() && glob.charAt(j) == ']') {
            j++;
        }
        while (j < glob.length() && glob.charAt(j) != ']') {
            j++;
        }
        return j < glob.length() ? j : -1;
    }

    private static String characterClass(String body) {
        StringBuilder builder = new StringBuilder("[");
        int i = 0;
        if (body.startsWith("!")) {
            builder.append('^');
            i = 1;
        } else if (body.startsWith("^")) {
            builder.append("\\^");
            i = 1;
        }
        for (; i < body.length(); i++) {
            char ch = body.charAt(i);
            switch (ch) {
                case '\\', '[', ']', '&', '^' -> builder.append('\\').append(ch);
                default -> builder.append(ch);
            }
        }
        return builder.append(']').toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
