/**
 *
 */
package flint.ds;

import java.io.IOException;

/**
 * Datasource exception with error code classification.
 * This allows callers to distinguish format, lookup, request and computation failures.
 */
public class DatasourceException extends IOException {

    private final ErrorCode errorCode;
    private final Object context;

    public DatasourceException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.context = null;
    }

    public DatasourceException(ErrorCode errorCode, Object context) {
        super(errorCode.getMessage() + " - " + context);
        this.errorCode = errorCode;
        this.context = context;
    }

    public DatasourceException(ErrorCode errorCode, Object context, Throwable cause) {
        super(errorCode.getMessage() + " - " + context, cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Get the context object associated with this exception
     * @return the context object, or null if not available
     */
    public Object getContext() {
        return context;
    }

    /**
     * Check if this exception has a specific error code
     * @param code the error code to check
     * @return true if the error code matches
     */
    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    /**
     * Check if this exception belongs to an error category
     * @param category the category to check
     * @return true if the category matches
     */
    public boolean isCategory(ErrorCode.Category category) {
        return this.errorCode.getCategory() == category;
    }

    public String toString() {
        return "DatasourceException{" +
                "errorCode=" + errorCode +
                ", context=" + context +
                '}';
    }
}
