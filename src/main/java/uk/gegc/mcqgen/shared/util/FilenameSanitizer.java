package uk.gegc.mcqgen.shared.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns user-supplied file names into safe, flat, ASCII-only names.
 * <p>
 * Path separators never survive, so a sanitized name can always be resolved
 * directly inside a storage directory.
 */
public final class FilenameSanitizer {

    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern PATH_SEPARATORS = Pattern.compile("[/\\\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_.-]");
    private static final Pattern EDGE_DOTS_AND_UNDERSCORES = Pattern.compile("^[._]+|[._]+$");

    private FilenameSanitizer() {
    }

    /**
     * Sanitize a file name.
     *
     * @param filename the raw name, possibly with directories
     * @return the sanitized name, never blank
     * @throws IllegalArgumentException if nothing usable remains
     */
    public static String sanitize(String filename) {
        if (filename == null) {
            throw new IllegalArgumentException("Filename cannot be null");
        }
        String ascii = NON_ASCII.matcher(Normalizer.normalize(filename, Normalizer.Form.NFKD)).replaceAll("");
        String flat = PATH_SEPARATORS.matcher(ascii).replaceAll(" ").strip();
        String joined = WHITESPACE.matcher(flat).replaceAll("_");
        String allowed = DISALLOWED.matcher(joined).replaceAll("");
        String result = EDGE_DOTS_AND_UNDERSCORES.matcher(allowed).replaceAll("");
        if (result.isBlank()) {
            throw new IllegalArgumentException("Filename '" + filename + "' has no usable characters");
        }
        return result;
    }

    /**
     * Name without its last extension: {@code "notes.v2.pdf"} becomes {@code "notes.v2"}.
     */
    public static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    /**
     * Lower-cased last extension without the dot, or an empty string.
     */
    public static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 && dot < filename.length() - 1
                ? filename.substring(dot + 1).toLowerCase(Locale.ROOT)
                : "";
    }
}
