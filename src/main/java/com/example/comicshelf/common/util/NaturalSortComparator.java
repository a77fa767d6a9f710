package com.example.comicshelf.common.util;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders strings by their embedded numeric runs numerically and text runs case-insensitively,
 * so "page2.jpg" sorts before "page10.jpg".
 */
public final class NaturalSortComparator implements Comparator<String> {

    public static final NaturalSortComparator INSTANCE = new NaturalSortComparator();

    private NaturalSortComparator() {
    }

    @Override
    public int compare(String a, String b) {
        List<String> left = split(a);
        List<String> right = split(b);
        int n = Math.min(left.size(), right.size());
        for (int i = 0; i < n; i++) {
            String l = left.get(i);
            String r = right.get(i);
            boolean lDigit = isDigits(l);
            boolean rDigit = isDigits(r);
            int cmp;
            if (lDigit && rDigit) {
                cmp = new BigInteger(l).compareTo(new BigInteger(r));
            } else if (lDigit) {
                cmp = -1;
            } else if (rDigit) {
                cmp = 1;
            } else {
                cmp = l.compareTo(r);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    static List<String> split(String value) {
        List<String> parts = new ArrayList<>();
        if (value == null || value.isEmpty()) {
            return parts;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        int start = 0;
        boolean digit = Character.isDigit(lower.charAt(0));
        for (int i = 1; i < lower.length(); i++) {
            boolean current = Character.isDigit(lower.charAt(i));
            if (current != digit) {
                parts.add(lower.substring(start, i));
                start = i;
                digit = current;
            }
        }
        parts.add(lower.substring(start));
        return parts;
    }

    private static boolean isDigits(String part) {
        return !part.isEmpty() && Character.isDigit(part.charAt(0));
    }
}
