package com.dcruver.goalrec.reporting;

import com.dcruver.goalrec.domain.ErrorKind;

import java.util.Locale;

/**
 * Number and error rendering shared by the reports.
 * Values are printed in scientific notation with 10 fraction digits.
 */
final class ReportFormats {

    private ReportFormats() {
    }

    static String scientific(double value) {
        return String.format(Locale.ROOT, "%.10e", value);
    }

    static String errorTag(ErrorKind kind) {
        return "ERROR[" + kind + "]";
    }
}
