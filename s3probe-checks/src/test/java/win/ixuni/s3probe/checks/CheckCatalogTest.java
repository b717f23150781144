package win.ixuni.s3probe.checks;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.s3probe.core.check.CategoryDefinition;
import win.ixuni.s3probe.core.check.CheckCategory;
import win.ixuni.s3probe.gateway.memory.MemoryStorageGateway;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckCatalogTest {

    @Test
    @DisplayName("Catalog lists the ten categories in run order")
    void categoriesInRunOrder() {
        List<String> names = CheckCatalog.categories().stream().map(CategoryDefinition::getName).toList();

        assertEquals(List.of("buckets", "objects", "multipart", "versioning", "tagging", "attributes",
                "metadata", "range_requests", "error_conditions", "sync"), names);
    }

    @Test
    @DisplayName("Every factory builds a category reporting its catalog name")
    void factoriesMatchNames() {
        MemoryStorageGateway gateway = MemoryCheckFixture.newGateway();
        for (CategoryDefinition definition : CheckCatalog.categories()) {
            CheckCategory category = definition.getFactory()
                    .create(MemoryCheckFixture.context(gateway, definition.getName()));

            assertEquals(definition.getName(), category.getName());
            assertFalse(definition.getDescription().isBlank());
            assertEquals(0, category.getSummary().getTotal(), "nothing ran yet");
        }
        gateway.close();
    }

    @Test
    @DisplayName("Catalog is read-only")
    void catalogIsImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> CheckCatalog.categories().clear());
    }
}
