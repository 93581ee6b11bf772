package io.github.chirino.checkin.archive;

import io.github.chirino.checkin.model.FileNames;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the preview images of an archive.
 *
 * <p>If at most {@code n} images exist all are returned. Otherwise, when any file name stem
 * contains a run of digits, only those images are considered: they are ordered by the value of
 * their first digit run (ties keep archive order) and the first {@code n} are taken. When no stem
 * has digits, all names are ordered by code point and the first {@code n} are taken.
 */
public final class PreviewSelector {

    /** Orders strings by Unicode code point rather than by UTF-16 unit. */
    static final Comparator<String> CODE_POINT_ORDER =
            (a, b) -> {
                int i = 0;
                int j = 0;
                while (i < a.length() && j < b.length()) {
                    int ca = a.codePointAt(i);
                    int cb = b.codePointAt(j);
                    if (ca != cb) {
                        return Integer.compare(ca, cb);
                    }
                    i += Character.charCount(ca);
                    j += Character.charCount(cb);
                }
                return Integer.compare(a.length() - i, b.length() - j);
            };

    private PreviewSelector() {}

    public static List<String> selectPreviews(List<String> images, int n) {
        if (n <= 0) {
            return List.of();
        }
        if (images.size() <= n) {
            return List.copyOf(images);
        }
        List<Numbered> numbered = new ArrayList<>();
        for (String image : images) {
            BigInteger number = firstNumber(FileNames.stem(image));
            if (number != null) {
                numbered.add(new Numbered(number, image));
            }
        }
        if (!numbered.isEmpty()) {
            // List.sort is stable
            numbered.sort(Comparator.comparing(Numbered::number));
            return numbered.stream().limit(n).map(Numbered::path).toList();
        }
        List<String> sorted = new ArrayList<>(images);
        sorted.sort(CODE_POINT_ORDER);
        return List.copyOf(sorted.subList(0, n));
    }

    /** Value of the first run of decimal digits, or {@code null} when there is none. */
    static BigInteger firstNumber(String text) {
        StringBuilder digits = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (Character.isDigit(cp)) {
                digits.append((char) ('0' + Character.digit(cp, 10)));
            } else if (digits.length() > 0) {
                break;
            }
            i += Character.charCount(cp);
        }
        return digits.length() == 0 ? null : new BigInteger(digits.toString());
    }

    private record Numbered(BigInteger number, String path) {}
}
