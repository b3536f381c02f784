package com.dcruver.itemstore.validation;

import com.dcruver.itemstore.domain.ContentKind;
import com.dcruver.itemstore.domain.ValidationException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks item payloads against their declared kind and guesses a kind when none is given.
 */
@Component
public class ItemContentValidator {

    private static final Pattern WINDOWS_PATH = Pattern.compile("^[A-Za-z]:\\\\.*");

    private static final Pattern FILE_EXTENSION = Pattern.compile(
        "\\.(exe|dll|py|js|ts|jsx|tsx|java|cpp|h|cs|go|rs|rb|php|html|css|json|xml|yml|yaml|md|txt|pdf"
            + "|doc|docx|xls|xlsx|ppt|pptx|zip|rar|tar|gz|7z|png|jpg|jpeg|gif|svg|mp4|mp3|avi|mov)$",
        Pattern.CASE_INSENSITIVE);

    private static final List<String> CODE_PREFIXES = List.of(
        "git ", "docker ", "npm ", "pip ", "python ", "node ", "mvn ", "java ",
        "cd ", "mkdir ", "chmod ", "chown ", "ls ", "cat ", "#!/",
        "def ", "class ", "import ", "from ", "export ", "function", "const ", "let ", "var ",
        "select ", "insert ", "update ", "delete ", "create ", "drop ", "alter ");

    private static final List<Pattern> CODE_SYNTAX = List.of(
        Pattern.compile("[{}\\[\\]()]"),
        Pattern.compile(";$"),
        Pattern.compile("=>|->"),
        Pattern.compile("::\\w+"),
        Pattern.compile("\\$\\w+"),
        Pattern.compile("\\s=\\s"));

    /**
     * Reject content that does not fit the kind.
     */
    public void validate(String content, ContentKind kind) {
        if (kind == null) {
            throw new ValidationException("Content kind is required");
        }
        if (content == null || content.isBlank()) {
            throw new ValidationException("Content cannot be empty");
        }
        if (kind == ContentKind.URL) {
            validateUrl(content.strip());
        }
    }

    /**
     * Guess the kind of a payload: URL, then path, then code, else text.
     */
    public ContentKind detect(String content) {
        if (content == null || content.isBlank()) {
            return ContentKind.TEXT;
        }
        String value = content.strip();
        String lower = value.toLowerCase(Locale.ROOT);

        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return ContentKind.URL;
        }
        if (WINDOWS_PATH.matcher(value).matches()
            || value.startsWith("/") || value.startsWith("~/") || value.startsWith("./")
            || FILE_EXTENSION.matcher(value).find()) {
            return ContentKind.PATH;
        }
        for (String prefix : CODE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return ContentKind.CODE;
            }
        }
        for (Pattern pattern : CODE_SYNTAX) {
            if (pattern.matcher(value).find()) {
                return ContentKind.CODE;
            }
        }
        return ContentKind.TEXT;
    }

    private void validateUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ValidationException("URL must start with http:// or https://: " + value);
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new ValidationException("URL has no host: " + value);
            }
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL: " + value);
        }
    }
}
