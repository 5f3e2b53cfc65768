package villagecompute.scheduler.jobs;

import org.junit.jupiter.api.Test;
import villagecompute.scheduler.jobs.templates.NoopJobTemplate;
import villagecompute.scheduler.testing.TestTemplates;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemplateRegistryTest {

    @Test
    void registersDiscoveredTemplatesByType() {
        TemplateRegistry registry = new TemplateRegistry(
                List.of(new NoopJobTemplate(), new TestTemplates.RangeCheck()));

        assertEquals(2, registry.size());
        assertTrue(registry.exists("noop"));
        assertTrue(registry.get("range_check").isPresent());
        assertFalse(registry.get("missing").isPresent());
    }

    @Test
    void rejectsDuplicateType() {
        TemplateRegistry registry = new TemplateRegistry(List.of(new NoopJobTemplate()));

        assertThrows(IllegalStateException.class, () -> registry.register(new NoopJobTemplate()));
    }

    @Test
    void listsMetadataSortedAndByCategory() {
        TemplateRegistry registry = new TemplateRegistry(
                List.of(new TestTemplates.RangeCheck(), new NoopJobTemplate(), new TestTemplates.AlwaysFails()));

        List<TemplateMetadata> all = registry.list();
        assertEquals(List.of("always_fails", "noop", "range_check"), all.stream().map(TemplateMetadata::type).toList());

        List<TemplateMetadata> testing = registry.listByCategory("testing");
        assertEquals(1, testing.size());
        assertEquals("range_check", testing.get(0).type());

        TemplateMetadata noop = registry.getMetadata("noop").orElseThrow();
        assertEquals("No-op", noop.name());
        assertEquals("maintenance", noop.category());
        assertEquals("noop", noop.defaultParameters().get("message"));
    }

    @Test
    void unregisterRemovesTemplate() {
        TemplateRegistry registry = new TemplateRegistry(List.of(new NoopJobTemplate()));

        assertTrue(registry.unregister("noop"));
        assertFalse(registry.unregister("noop"));
        assertEquals(0, registry.size());
    }
}
