package com.shlawgathon.specmerge.backend.repository;

import com.shlawgathon.specmerge.backend.model.DefectRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DefectRecordRepository extends MongoRepository<DefectRecord, String> {

    List<DefectRecord> findByBatchId(String batchId);
}
