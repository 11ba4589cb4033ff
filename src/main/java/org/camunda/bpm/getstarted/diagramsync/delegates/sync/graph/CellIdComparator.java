package org.camunda.bpm.getstarted.diagramsync.delegates.sync.graph;

import java.util.Comparator;

/**
 * Orders cell ids numerically when they are numbers and lexicographically otherwise. Numeric ids
 * sort before textual ones.
 */
public class CellIdComparator implements Comparator<String> {
    public static final CellIdComparator INSTANCE = new CellIdComparator();

    @Override
    public int compare(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            String a = stripLeadingZeros(left);
            String b = stripLeadingZeros(right);
            if (a.length() != b.length()) {
                return Integer.compare(a.length(), b.length());
            }
            int byDigits = a.compareTo(b);
            return byDigits != 0 ? byDigits : left.compareTo(right);
        }
        if (leftNumeric) {
            return -1;
        }
        if (rightNumeric) {
            return 1;
        }
        return left.compareTo(right);
    }

    public static boolean isNumeric(String id) {
        if (id == null || id.isEmpty()) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
