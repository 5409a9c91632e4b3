package org.labrad.timing.errors;

import org.labrad.timing.validation.ValidationReport;

/**
 * Raised at the end of compilation when the validator found problems.
 * Carries every violation found, not just the first.
 */
public class ValidationException extends CompilationException {
  private static final long serialVersionUID = 1L;

  private final transient ValidationReport report;

  public ValidationException(ValidationReport report) {
    super(report.format());
    this.report = report;
  }

  public ValidationReport getReport() {
    return report;
  }
}
