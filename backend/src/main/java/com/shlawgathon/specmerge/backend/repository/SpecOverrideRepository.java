package com.shlawgathon.specmerge.backend.repository;

import com.shlawgathon.specmerge.backend.model.SpecOverride;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SpecOverrideRepository extends MongoRepository<SpecOverride, String> {

    Optional<SpecOverride> findByParameter(String parameter);
}
