package com.wingman.core.fs;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code CombatReports/<serial>} folder and its report files, sorted by path.
 */
public record CombatReportFolder(String serialNumber, Path folder, List<Path> reports) {

    public CombatReportFolder {
        reports = List.copyOf(reports);
    }
}
