package win.ixuni.s3probe.core.model;

/**
 * Attribute names accepted by GetObjectAttributes
 */
public enum ObjectAttribute {
    ETAG,
    OBJECT_SIZE,
    STORAGE_CLASS,
    OBJECT_PARTS,
    CHECKSUM
}
