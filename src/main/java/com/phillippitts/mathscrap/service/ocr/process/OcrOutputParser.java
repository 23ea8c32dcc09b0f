package com.phillippitts.mathscrap.service.ocr.process;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses recognizer stdout into text fragments.
 *
 * <p>EasyOCR ({@code --detail 1}) and PaddleOCR print one Python tuple per detected box,
 * ending in {@code 'text', confidence)}. Both quote styles Python's repr emits are accepted,
 * and a confidence wrapped as {@code np.float64(0.9)} is unwrapped. Lines without such a
 * tuple (progress, warnings) are ignored.
 */
public final class OcrOutputParser {

    private static final String NUMBER = "[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?";

    private static final Pattern FRAGMENT = Pattern.compile(
            "(?:'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\")\\s*,\\s*"
                    + "(?:np\\.float(?:32|64)\\((" + NUMBER + ")\\)|(" + NUMBER + "))\\s*[)\\]]");

    private static final Pattern PIX2TEX_PREFIX = Pattern.compile("^\\S[^:]*?\\.(?:png|jpe?g|bmp|gif|tiff?):\\s*",
            Pattern.CASE_INSENSITIVE);

    private OcrOutputParser() {
    }

    /**
     * One detected text box.
     *
     * @param text       detected text, unescaped
     * @param confidence per-box score reported by the recognizer
     */
    public record Fragment(String text, double confidence) {
    }

    /**
     * Extracts every {@code ('text', confidence)} pair in output order.
     */
    public static List<Fragment> parseFragments(String stdout) {
        List<Fragment> fragments = new ArrayList<>();
        if (stdout == null || stdout.isBlank()) {
            return fragments;
        }
        for (String line : stdout.split("\\R")) {
            Matcher m = FRAGMENT.matcher(line);
            while (m.find()) {
                String raw = m.group(1) != null ? m.group(1) : m.group(2);
                fragments.add(new Fragment(unescape(raw), Double.parseDouble(m.group(3) != null ? m.group(3) : m.group(4))));
            }
        }
        return fragments;
    }

    /**
     * Joins fragments scored at or above {@code minConfidence} with single spaces.
     */
    public static String joinFragments(List<Fragment> fragments, double minConfidence) {
        StringBuilder sb = new StringBuilder();
        for (Fragment fragment : fragments) {
            String text = fragment.text().strip();
            if (fragment.confidence() < minConfidence || text.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(text);
        }
        return sb.toString();
    }

    /**
     * Extracts LaTeX from pix2tex output. The CLI prints {@code <file>: <latex>} per image;
     * the last non-blank line wins and the file prefix is removed.
     *
     * @return markup, or an empty string when there is none
     */
    public static String parsePix2Tex(String stdout) {
        if (stdout == null) {
            return "";
        }
        String last = "";
        for (String line : stdout.split("\\R")) {
            if (!line.isBlank()) {
                last = line.strip();
            }
        }
        return PIX2TEX_PREFIX.matcher(last).replaceFirst("").strip();
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                sb.append(s.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
