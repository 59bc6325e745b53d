package findata.collector.service;

import findata.collector.model.JobDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only registry of every configured job, keyed by name, in configuration order.
 */
public final class JobCatalog {

    private final Map<String, JobDescriptor> jobs;

    public JobCatalog(List<JobDescriptor> descriptors) {
        Map<String, JobDescriptor> byName = new LinkedHashMap<>();
        for (JobDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate job name: '" + descriptor.name() + "'");
            }
        }
        this.jobs = Collections.unmodifiableMap(byName);
    }

    public Optional<JobDescriptor> find(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    /** Enabled job by name; disabled and unknown jobs are both absent. */
    public Optional<JobDescriptor> findEnabled(String name) {
        return find(name).filter(JobDescriptor::enabled);
    }

    public List<JobDescriptor> all() {
        return List.copyOf(jobs.values());
    }

    public List<JobDescriptor> enabled() {
        return jobs.values().stream().filter(JobDescriptor::enabled).toList();
    }

    public int size() {
        return jobs.size();
    }
}
