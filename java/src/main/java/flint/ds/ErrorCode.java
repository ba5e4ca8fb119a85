/**
 *
 */
package flint.ds;

/**
 * Error codes for datasource operations
 */
public enum ErrorCode {
    // Source format errors (-1000 to -1999)
    FILE_NOT_READABLE(-1000, "File cannot be opened", Category.FORMAT),
    EMPTY_FILE(-1001, "No header", Category.FORMAT),
    DIALECT_NOT_DETECTED(-1002, "Could not determine delimiter", Category.FORMAT),
    INVALID_DATE(-1003, "Index value is not a date", Category.FORMAT),
    MALFORMED_ROW(-1004, "Malformed row", Category.FORMAT),

    // Lookup errors (-3000 to -3999)
    FOLDER_NOT_FOUND(-3000, "Folder not found", Category.NOT_FOUND),
    SOURCE_NOT_FOUND(-3001, "Source not found", Category.NOT_FOUND),
    FINDER_NOT_FOUND(-3002, "Annotation finder not found", Category.NOT_FOUND),
    INDEX_NOT_FOUND(-3003, "Index column not found", Category.NOT_FOUND),

    // Request errors (-4000 to -4999)
    INVALID_REQUEST(-4000, "Invalid request", Category.REJECTED),
    INVALID_QUERY(-4001, "Invalid query", Category.REJECTED),

    // Metric computation errors (-6000 to -6999)
    UNKNOWN_METRIC(-6000, "Unknown special metric", Category.COMPUTE),
    COLUMN_NOT_FOUND(-6001, "Column not found", Category.COMPUTE),
    NOT_NUMERIC(-6002, "Column is not numeric", Category.COMPUTE),
    SINGLE_CLASS_GROUP(-6003, "Only one class present in group", Category.COMPUTE),
    NOT_BINARY(-6004, "Outcome column is not binary", Category.COMPUTE),
    MISSING_VALUE(-6005, "Input contains missing values", Category.COMPUTE);

    /**
     * Error classes as seen by the caller
     */
    public enum Category {
        FORMAT(500),
        NOT_FOUND(404),
        REJECTED(400),
        COMPUTE(500);

        private final int status;

        Category(int status) {
            this.status = status;
        }

        /**
         * HTTP status reported for this category
         */
        public int status() {
            return status;
        }
    }

    private final int code;
    private final String message;
    private final Category category;

    ErrorCode(int code, String message, Category category) {
        this.code = code;
        this.message = message;
        this.category = category;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Category getCategory() {
        return category;
    }
}
