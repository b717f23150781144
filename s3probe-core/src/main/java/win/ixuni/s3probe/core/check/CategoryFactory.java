package win.ixuni.s3probe.core.check;

/**
 * Creates a fresh category instance for one run
 */
@FunctionalInterface
public interface CategoryFactory {

    CheckCategory create(CategoryContext context);
}
