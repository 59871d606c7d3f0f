package com.wingman.core.model;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Ordering for pilot serial numbers: numeric when both sides are digits, lexicographic otherwise.
 */
public final class SerialNumbers {

    public static final Comparator<String> ORDER = SerialNumbers::compare;

    private SerialNumbers() {
    }

    public static int compare(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            int byValue = new BigInteger(left).compareTo(new BigInteger(right));
            return byValue != 0 ? byValue : left.compareTo(right);
        }
        if (leftNumeric) {
            return -1;
        }
        if (rightNumeric) {
            return 1;
        }
        return left.compareTo(right);
    }

    public static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
