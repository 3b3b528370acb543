package io.github.cyfko.reportwriter.core.exception;

/**
 * Exception thrown when a report definition or its paging configuration is invalid.
 * <p>
 * This runtime exception signals programmer errors detected while a report is being set up,
 * never per-request conditions. A report that fails with this exception is never constructed,
 * so no request can ever observe a half-configured report.
 * </p>
 *
 * <p><strong>Common Failure Scenarios:</strong></p>
 * <ul>
 *   <li>No column declared, or two columns sharing the same key</li>
 *   <li>Blank column key or blank query fragment</li>
 *   <li>Missing default sort key, or a default naming an unknown or non-sortable column</li>
 *   <li>Non-positive results per page or pages in list</li>
 *   <li>Blank or colliding request variable names</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * try {
 *     ReportDefinition definition = ReportDefinition.builder()
 *         .column("name")
 *         .defaultSort("age")      // not declared
 *         .build();
 * } catch (ReportConfigurationException e) {
 *     // "Default sort key 'age' does not name a declared column"
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ReportConfigurationException extends RuntimeException {

    /**
     * Creates a new ReportConfigurationException with detailed message.
     *
     * @param message explanation of the configuration error
     */
    public ReportConfigurationException(String message) {
        super(message);
    }

    /**
     * Creates a new ReportConfigurationException with detailed message and cause.
     *
     * @param message explanation of the configuration error
     * @param cause underlying exception causing this failure
     */
    public ReportConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
