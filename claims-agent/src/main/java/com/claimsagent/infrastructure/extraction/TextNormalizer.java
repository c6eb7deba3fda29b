package com.claimsagent.infrastructure.extraction;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans document text before field matching:
 * - Unicode NFC normalization
 * - Invisible/control character removal (form feeds from PDF page breaks included)
 * - Non-breaking and typographic spaces to plain spaces
 * - Whitespace normalization (collapse runs, trim every line)
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Vertical tab and form feed (PDF page breaks) end a line
    private static final Pattern LINE_BREAK_CONTROLS = Pattern.compile("[\\x0B\\x0C]");

    // Other control characters except \n, \r, \t
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0E-\\x1F\\x7F]"
    );

    // NBSP, figure space, narrow NBSP and the other Unicode space separators
    private static final Pattern UNICODE_SPACES = Pattern.compile("[\\u00A0\\u2000-\\u200A\\u202F\\u205F\\u3000]");

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]+");

    private static final Pattern LINE_EDGE_SPACES = Pattern.compile("(?m)^[ \\t]+|[ \\t]+$");

    // 3+ consecutive newlines → 2 newlines
    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * Normalize the document text.
     *
     * @param text raw document text
     * @return normalized text, empty for blank input
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        result = LINE_BREAK_CONTROLS.matcher(result).replaceAll("\n");

        result = CONTROL_CHARS.matcher(result).replaceAll("");

        result = result.replace("\r\n", "\n").replace("\r", "\n");

        result = UNICODE_SPACES.matcher(result).replaceAll(" ");

        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");

        result = LINE_EDGE_SPACES.matcher(result).replaceAll("");

        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }
}
