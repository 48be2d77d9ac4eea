package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.Job;
import com.fieldpilot.lifecycle.model.JobState;
import com.fieldpilot.lifecycle.model.StateTransition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** {@link JobStore} backed by the Spring Data repositories. */
@Component
public class JpaJobStore implements JobStore {

    private final JobRepository             jobRepo;
    private final StateTransitionRepository transitionRepo;

    public JpaJobStore(JobRepository jobRepo, StateTransitionRepository transitionRepo) {
        this.jobRepo        = jobRepo;
        this.transitionRepo = transitionRepo;
    }

    @Override
    public Optional<Job> findById(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    @Override
    public Optional<Job> lockById(UUID jobId) {
        return jobRepo.findByIdForUpdate(jobId);
    }

    @Override
    public Job save(Job job) {
        return jobRepo.save(job);
    }

    @Override
    public StateTransition appendTransition(StateTransition transition) {
        return transitionRepo.save(transition);
    }

    @Override
    public List<StateTransition> history(UUID jobId) {
        return transitionRepo.findByJobIdOrderBySequenceNoAsc(jobId);
    }

    @Override
    public boolean hasOtherLiveJobs(UUID clientId, UUID excludedJobId) {
        return jobRepo.countByClientIdAndIdNotAndStateNot(clientId, excludedJobId, JobState.CANCELLED) > 0;
    }
}
