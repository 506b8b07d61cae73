package socialjobs.worker.repository;

import socialjobs.worker.model.Lead;

import java.util.Optional;

public interface LeadRepository {

    /**
     * Find a lead inside an org.
     */
    Optional<Lead> findById(String orgId, String leadId);

    void save(Lead lead);
}
