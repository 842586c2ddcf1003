package com.example.ytmdl.utils.constants;

import java.util.regex.Pattern;

public class RegexPatterns {
    // [download]  45.2% of 3.45MiB at 1.23MiB/s ETA 00:02
    // [download] 100% of 3.45MiB in 00:15
    public static final Pattern PROGRESS_PATTERN = Pattern.compile(
            "\\[download]\\s+(\\d+(?:\\.\\d+)?)%\\s+of\\s+~?[\\d.]+\\w+(?:\\s+at\\s+[\\d.]+\\w+/s)?(?:\\s+ETA\\s+[\\d:]+)?(?:\\s+in\\s+[\\d:]+)?");
    // Step 3 of 5: ... | [3/5] ...
    public static final Pattern STEP_PATTERN = Pattern.compile("Step\\s+(\\d+)\\s+of\\s+(\\d+)|\\[(\\d+)/(\\d+)]");
    public static final Pattern ANSI_PATTERN = Pattern.compile("\\x1b\\[[0-9;]*m");
    public static final Pattern METADATA_PATTERN = Pattern.compile("^\\[gytmdl]\\s+(Title|Artist|Album):\\s*(.+)$");
}
