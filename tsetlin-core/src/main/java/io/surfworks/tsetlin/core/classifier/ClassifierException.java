package io.surfworks.tsetlin.core.classifier;

/**
 * Exception thrown when a classifier call is rejected before reaching the engine.
 */
public class ClassifierException extends RuntimeException {

    private final ErrorCode errorCode;

    public ClassifierException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ClassifierException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Classifier error codes.
     */
    public enum ErrorCode {
        /** Input shape, dtype or label set rejected */
        VALIDATION,

        /** Operation needs a bound machine but none is held */
        NOT_FITTED
    }

    public static ClassifierException validation(String message) {
        return new ClassifierException(message, ErrorCode.VALIDATION);
    }

    public static ClassifierException notFitted(String operation) {
        return new ClassifierException(
                "This classifier is not fitted yet; call fit, partialFit or initEmptyState before " + operation,
                ErrorCode.NOT_FITTED);
    }

    public static ClassifierException tooFewClasses(int count) {
        return validation("This classifier needs at least 2 classes; got " + count);
    }

    public static ClassifierException featureMismatch(int expected, int actual) {
        return validation(String.format("Number of features of the input must be %d, got %d", expected, actual));
    }

    public static ClassifierException classesMismatch() {
        return validation("Provided classes do not match the classes seen during initialization.");
    }

    public boolean isValidation() {
        return errorCode == ErrorCode.VALIDATION;
    }

    public boolean isNotFitted() {
        return errorCode == ErrorCode.NOT_FITTED;
    }
}
