package io.mistral.core.scheduler;

import com.google.common.base.Optional;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class JobFilterTest
{
    @Test
    public void allMatchesEverything()
    {
        assertThat(JobFilter.all().matches(Optional.of("k"), true), is(true));
        assertThat(JobFilter.all().matches(Optional.absent(), false), is(true));
    }

    @Test
    public void keyFilter()
    {
        JobFilter filter = JobFilter.all().withKey("k");
        assertThat(filter.matches(Optional.of("k"), false), is(true));
        assertThat(filter.matches(Optional.of("other"), false), is(false));
        assertThat(filter.matches(Optional.absent(), false), is(false));
    }

    @Test
    public void nullKeyMatchesJobsWithoutKey()
    {
        JobFilter filter = JobFilter.all().withKey(null);
        assertThat(filter.isKeyFiltered(), is(true));
        assertThat(filter.matches(Optional.absent(), true), is(true));
        assertThat(filter.matches(Optional.of("k"), true), is(false));
    }

    @Test
    public void processingFilter()
    {
        JobFilter filter = JobFilter.all().withKey("k").withProcessing(true);
        assertThat(filter.matches(Optional.of("k"), true), is(true));
        assertThat(filter.matches(Optional.of("k"), false), is(false));
    }
}
