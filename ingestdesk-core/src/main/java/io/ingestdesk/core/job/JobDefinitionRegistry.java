package io.ingestdesk.core.job;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.ingestdesk.core.repository.ResourceNotFoundException;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Catalogue of the ingestion jobs that can be scheduled or started.
 */
public class JobDefinitionRegistry
{
    public static final String WILDBERRIES = "wildberries";
    public static final String INTERNAL = "internal";

    private static final Comparator<JobDefinition> LISTING_ORDER = Comparator
        .comparing(JobDefinition::getSourceCode)
        .thenComparing(JobDefinition::getTitle);

    static List<JobDefinition> builtinJobs()
    {
        return ImmutableList.of(
                JobDefinition.of("products", "Product catalog", WILDBERRIES, true, true),
                JobDefinition.of("warehouses", "Warehouses", WILDBERRIES, true, true),
                JobDefinition.of("stocks", "FBS stocks", WILDBERRIES, true, true),
                JobDefinition.of("supplier_stocks", "FBO stocks", WILDBERRIES, true, true),
                JobDefinition.of("prices", "Prices", WILDBERRIES, true, true),
                JobDefinition.of("frontend_prices", "Storefront prices", WILDBERRIES, true, true),
                // needs a date_from/date_to range, so it is started by hand only
                JobDefinition.of("wb_finances", "Financial reports", WILDBERRIES, false, true),
                JobDefinition.of("rrp_xml", "Price list XML (1C)", INTERNAL, true, true),
                JobDefinition.of("build_tax_statement", "Tax statement", INTERNAL, false, true));
    }

    private final Map<String, JobDefinition> jobs;

    @Inject
    public JobDefinitionRegistry()
    {
        this(builtinJobs());
    }

    public JobDefinitionRegistry(List<JobDefinition> jobs)
    {
        ImmutableMap.Builder<String, JobDefinition> builder = ImmutableMap.builder();
        for (JobDefinition job : jobs) {
            builder.put(job.getJobCode(), job);
        }
        this.jobs = builder.build();
    }

    /**
     * Returns all jobs ordered by source code and title.
     */
    public List<JobDefinition> getJobDefinitions()
    {
        return jobs.values().stream()
            .sorted(LISTING_ORDER)
            .collect(toImmutableList());
    }

    public List<JobDefinition> getJobDefinitionsOfSource(String sourceCode)
    {
        return getJobDefinitions().stream()
            .filter(job -> job.getSourceCode().equals(sourceCode))
            .collect(toImmutableList());
    }

    public Optional<JobDefinition> getJobDefinition(String jobCode)
    {
        return Optional.fromNullable(jobs.get(jobCode));
    }

    public JobDefinition requireJobDefinition(String jobCode)
        throws ResourceNotFoundException
    {
        JobDefinition job = jobs.get(jobCode);
        if (job == null) {
            throw new ResourceNotFoundException("Unknown job_code: " + jobCode);
        }
        return job;
    }

    public boolean isKnownSource(String sourceCode)
    {
        for (JobDefinition job : jobs.values()) {
            if (job.getSourceCode().equals(sourceCode)) {
                return true;
            }
        }
        return false;
    }
}
