package com.shlawgathon.specmerge.backend.repository;

import com.shlawgathon.specmerge.backend.model.SpecVariant;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SpecVariantRepository extends MongoRepository<SpecVariant, String> {

    List<SpecVariant> findByParameter(String parameter);

    List<SpecVariant> findByBatchId(String batchId);
}
