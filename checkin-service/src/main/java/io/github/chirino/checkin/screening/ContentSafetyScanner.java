package io.github.chirino.checkin.screening;

import com.google.re2j.Pattern;
import java.util.ArrayList;
import java.util.List;

/**
 * Pattern scanner for submitted text. All patterns are RE2 expressions, so matching time is linear
 * in the input, and input is truncated to {@code maxScanLength} characters before matching.
 *
 * <p>Checks run in order: markup and script injection, query injection heuristics, the spam
 * keyword list and, for display names only, known bot nickname templates. The query checks are a
 * tripwire only; persistence always uses bound parameters.
 */
public class ContentSafetyScanner {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> MARKUP =
            List.of(
                    Pattern.compile("<[a-z!/?]", FLAGS),
                    Pattern.compile("\\b(javascript|vbscript)\\s*:", FLAGS),
                    Pattern.compile("\\bdata\\s*:\\s*[a-z]+/", FLAGS),
                    Pattern.compile(
                            "\\bon(load|unload|error|abort|click|dblclick|mouse[a-z]*|key[a-z]*"
                                    + "|focus[a-z]*|blur|change|submit|reset|input|select"
                                    + "|pointer[a-z]*|touch[a-z]*|drag[a-z]*|drop|wheel|scroll"
                                    + "|resize|animation[a-z]*|transition[a-z]*|toggle|begin"
                                    + "|message|pageshow|pagehide|beforeunload|hashchange"
                                    + "|copy|cut|paste|play|pause|contextmenu)\\s*=",
                            FLAGS),
                    Pattern.compile("expression\\s*\\(", FLAGS),
                    Pattern.compile("url\\s*\\(", FLAGS));

    private static final List<Pattern> QUERY_INJECTION =
            List.of(
                    Pattern.compile("'\\s*or\\s+'?[a-z0-9_]+'?\\s*=\\s*'?[a-z0-9_]+", FLAGS),
                    Pattern.compile("\\bor\\s+1\\s*=\\s*1\\b", FLAGS),
                    Pattern.compile(
                            ";\\s*(drop|delete|insert|update|alter|create|truncate|exec)\\b",
                            FLAGS),
                    Pattern.compile("\\bunion\\s+(all\\s+)?select\\b", FLAGS),
                    Pattern.compile("'\\s*(--|#)"),
                    Pattern.compile("/\\*"));

    private final KeywordDenylist keywords;
    private final int maxScanLength;
    private final List<Pattern> nicknameTemplates;

    public ContentSafetyScanner(
            KeywordDenylist keywords, int maxScanLength, List<String> nicknamePhrases) {
        this.keywords = keywords;
        this.maxScanLength = maxScanLength;
        List<Pattern> templates = new ArrayList<>();
        for (String phrase : nicknamePhrases) {
            if (phrase != null && !phrase.isBlank()) {
                templates.add(
                        Pattern.compile(
                                "^\\s*" + Pattern.quote(phrase.trim()) + "[\\s_-]*\\d*\\s*$",
                                FLAGS));
            }
        }
        this.nicknameTemplates = List.copyOf(templates);
    }

    /** Scans free text: markup, query injection and spam keywords. */
    public ScanResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return ScanResult.safeResult();
        }
        String input = cap(text);
        if (anyMatch(MARKUP, input)) {
            return ScanResult.unsafe(ScanResult.Category.MARKUP);
        }
        if (anyMatch(QUERY_INJECTION, input)) {
            return ScanResult.unsafe(ScanResult.Category.QUERY_INJECTION);
        }
        if (keywords.matches(input)) {
            return ScanResult.unsafe(ScanResult.Category.SPAM_KEYWORD);
        }
        return ScanResult.safeResult();
    }

    /**
     * Scans a display name. A {@link ScanResult.Category#NICKNAME_PATTERN} result is not a
     * rejection by itself; callers hold such submissions for review.
     */
    public ScanResult scanDisplayName(String name) {
        ScanResult general = scan(name);
        if (!general.safe()) {
            return general;
        }
        if (name != null && matchesNicknameTemplate(cap(name))) {
            return ScanResult.unsafe(ScanResult.Category.NICKNAME_PATTERN);
        }
        return ScanResult.safeResult();
    }

    public boolean matchesNicknameTemplate(String name) {
        return name != null && anyMatch(nicknameTemplates, name);
    }

    private String cap(String text) {
        return text.length() > maxScanLength ? text.substring(0, maxScanLength) : text;
    }

    private static boolean anyMatch(List<Pattern> patterns, String input) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(input).find()) {
                return true;
            }
        }
        return false;
    }
}
