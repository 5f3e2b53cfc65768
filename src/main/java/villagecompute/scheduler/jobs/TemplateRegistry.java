package villagecompute.scheduler.jobs;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide map from template type to {@link JobTemplate} implementation.
 *
 * <p>
 * Populated at startup from every CDI-managed {@link JobTemplate} bean. Job definitions refer to templates only by
 * their type key, so a registry miss at run time surfaces as a failed execution rather than an exception.
 */
@ApplicationScoped
public class TemplateRegistry {

    private static final Logger LOG = Logger.getLogger(TemplateRegistry.class);

    private final Map<String, JobTemplate> templates = new ConcurrentHashMap<>();

    @Inject
    public TemplateRegistry(Instance<JobTemplate> discovered) {
        this((Iterable<JobTemplate>) discovered);
    }

    public TemplateRegistry(Iterable<JobTemplate> discovered) {
        for (JobTemplate template : discovered) {
            register(template);
        }
        LOG.infof("Initialized TemplateRegistry with %d registered templates", templates.size());
    }

    /**
     * Registers a template under its {@link JobTemplate#templateType()}.
     *
     * @throws IllegalStateException
     *             if another template already owns the type
     * @throws IllegalArgumentException
     *             if the type key is blank
     */
    public void register(JobTemplate template) {
        String type = template.templateType();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException(
                    "Template " + template.getClass().getName() + " declares a blank template type");
        }
        JobTemplate existing = templates.putIfAbsent(type, template);
        if (existing != null) {
            throw new IllegalStateException("Duplicate templates registered for type '" + type + "': "
                    + existing.getClass().getName() + " and " + template.getClass().getName());
        }
        LOG.debugf("Registered template %s for type %s (category: %s)", template.getClass().getSimpleName(), type,
                template.category());
    }

    /**
     * Removes a template. Jobs that still reference it fail at their next run.
     *
     * @return true if a template was removed
     */
    public boolean unregister(String templateType) {
        JobTemplate removed = templates.remove(templateType);
        if (removed != null) {
            LOG.infof("Unregistered template %s", templateType);
        }
        return removed != null;
    }

    public Optional<JobTemplate> get(String templateType) {
        return templateType == null ? Optional.empty() : Optional.ofNullable(templates.get(templateType));
    }

    public boolean exists(String templateType) {
        return templateType != null && templates.containsKey(templateType);
    }

    /**
     * Returns all registered template types, sorted.
     */
    public List<String> listTypes() {
        return templates.keySet().stream().sorted().toList();
    }

    public List<TemplateMetadata> list() {
        return templates.values().stream().map(JobTemplate::metadata)
                .sorted(Comparator.comparing(TemplateMetadata::type)).toList();
    }

    public List<TemplateMetadata> listByCategory(String category) {
        return list().stream().filter(m -> m.category().equalsIgnoreCase(category)).toList();
    }

    public Optional<TemplateMetadata> getMetadata(String templateType) {
        return get(templateType).map(JobTemplate::metadata);
    }

    public int size() {
        return templates.size();
    }
}
