package win.ixuni.s3probe.core.check;

import lombok.Value;

/**
 * Entry of the static category table: name, human description and constructor
 */
@Value
public class CategoryDefinition {

    String name;

    String description;

    CategoryFactory factory;
}
