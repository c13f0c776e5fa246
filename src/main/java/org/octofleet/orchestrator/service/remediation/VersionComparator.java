package org.octofleet.orchestrator.service.remediation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Numeric, segment-wise version ordering: "1.10.0" &gt; "1.9.0", "2.0" == "2.0.0".
 * Non-numeric noise ("v", "-beta", build suffixes in parentheses) is ignored;
 * a version without any digits sorts first.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private VersionComparator() {}

    @Override
    public int compare(String a, String b) {
        var pa = parts(a);
        var pb = parts(b);
        if (pa.isEmpty() || pb.isEmpty()) {
            return Boolean.compare(!pa.isEmpty(), !pb.isEmpty());
        }
        int n = Math.max(pa.size(), pb.size());
        for (int i = 0; i < n; i++) {
            var x = i < pa.size() ? pa.get(i) : "0";
            var y = i < pb.size() ? pb.get(i) : "0";
            int c = compareDigits(x, y);
            if (c != 0) return c;
        }
        return 0;
    }

    public static boolean isOlder(String installed, String fixed) {
        return INSTANCE.compare(installed, fixed) < 0;
    }

    private static List<String> parts(String v) {
        var out = new ArrayList<String>();
        if (v == null) return out;
        var m = DIGITS.matcher(v);
        while (m.find()) out.add(stripZeros(m.group()));
        return out;
    }

    // arbitrary length segments (date-stamped builds overflow long)
    private static int compareDigits(String x, String y) {
        if (x.length() != y.length()) return Integer.compare(x.length(), y.length());
        return x.compareTo(y);
    }

    private static String stripZeros(String s) {
        int i = 0;
        while (i < s.length() - 1 && s.charAt(i) == '0') i++;
        return s.substring(i);
    }
}
