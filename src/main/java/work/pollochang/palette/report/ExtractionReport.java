package work.pollochang.palette.report;

import work.pollochang.palette.core.ExtractionOutcome;

public record ExtractionReport(ExtractionOutcome outcome, int colorCount) {}
