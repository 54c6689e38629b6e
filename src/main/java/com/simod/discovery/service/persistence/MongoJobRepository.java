package com.simod.discovery.service.persistence;

import com.simod.discovery.service.config.StorageConfig;
import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobField;
import com.simod.discovery.service.job.JobRepository;
import com.simod.discovery.service.job.JobStatus;
import com.simod.discovery.service.job.JobUpdate;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB implementation of JobRepository.
 *
 * Status transitions are a single {@code findAndModify} whose filter includes
 * the expected status, so the document-level atomicity of MongoDB provides
 * the compare-and-set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "discovery.storage", name = "repository", havingValue = "mongo", matchIfMissing = true)
public class MongoJobRepository implements JobRepository {

    private static final String ID = "_id";
    private static final String STATUS = JobField.STATUS.documentField();
    private static final String SUBMITTED_AT = "submittedAt";
    private static final String EXPIRES_AT = JobField.EXPIRES_AT.documentField();

    private final MongoTemplate mongoTemplate;
    private final StorageConfig storageConfig;

    @PostConstruct
    void init() {
        execute("create indexes", () -> {
            var indexOps = mongoTemplate.indexOps(collection());
            indexOps.ensureIndex(new Index().on(STATUS, Sort.Direction.ASC).on(SUBMITTED_AT, Sort.Direction.ASC));
            indexOps.ensureIndex(new Index().on(EXPIRES_AT, Sort.Direction.ASC));
            return null;
        });
        log.info("MongoJobRepository initialized, collection: {}", collection());
    }

    @Override
    public Job insert(Job job) {
        try {
            return mongoTemplate.insert(job, collection());
        } catch (DuplicateKeyException e) {
            throw new StorageException("Discovery already exists: " + job.getId(), job.getId(), e);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to insert discovery " + job.getId() + ": " + e.getMessage(), job.getId(), e);
        }
    }

    @Override
    public Optional<Job> findById(String id) {
        return execute("find discovery " + id,
                () -> Optional.ofNullable(mongoTemplate.findById(id, Job.class, collection())));
    }

    @Override
    public List<Job> findAll() {
        return execute("list discoveries",
                () -> mongoTemplate.find(new Query().with(bySubmission()), Job.class, collection()));
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        Query query = Query.query(Criteria.where(STATUS).is(status)).with(bySubmission());
        return execute("find discoveries by status " + status,
                () -> mongoTemplate.find(query, Job.class, collection()));
    }

    @Override
    public List<Job> findExpired(Instant now) {
        Query query = Query.query(Criteria.where(EXPIRES_AT).lte(now)).with(bySubmission());
        return execute("find expired discoveries",
                () -> mongoTemplate.find(query, Job.class, collection()));
    }

    @Override
    public Optional<Job> updateIfStatus(String id, Collection<JobStatus> expected, JobUpdate update) {
        Query query = Query.query(Criteria.where(ID).is(id).and(STATUS).in(expected));
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
        return execute("update discovery " + id,
                () -> Optional.ofNullable(
                        mongoTemplate.findAndModify(query, toMongoUpdate(update), options, Job.class, collection())));
    }

    @Override
    public boolean delete(String id) {
        Query query = Query.query(Criteria.where(ID).is(id));
        return execute("delete discovery " + id,
                () -> mongoTemplate.remove(query, Job.class, collection()).getDeletedCount() > 0);
    }

    @Override
    public long count() {
        return execute("count discoveries",
                () -> mongoTemplate.count(new Query(), Job.class, collection()));
    }

    // ==================== Helper Methods ====================

    private Update toMongoUpdate(JobUpdate update) {
        Update mongoUpdate = new Update();
        update.assignments().forEach((field, value) -> {
            if (value == null) {
                mongoUpdate.unset(field.documentField());
            } else {
                mongoUpdate.set(field.documentField(), value);
            }
        });
        update.increments().forEach(field -> mongoUpdate.inc(field.documentField(), 1));
        return mongoUpdate;
    }

    private Sort bySubmission() {
        return Sort.by(Sort.Direction.ASC, SUBMITTED_AT);
    }

    private String collection() {
        return storageConfig.getCollection();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to " + operation + ": " + e.getMessage(), e);
        }
    }
}
