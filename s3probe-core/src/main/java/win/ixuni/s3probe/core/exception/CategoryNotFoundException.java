package win.ixuni.s3probe.core.exception;

/**
 * Category not found exception
 */
public class CategoryNotFoundException extends ProbeException {

    public CategoryNotFoundException(String categoryName) {
        super("CategoryNotFound", "The specified check category does not exist: " + categoryName, 0);
    }
}
