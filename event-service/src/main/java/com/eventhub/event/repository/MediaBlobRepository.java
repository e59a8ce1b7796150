package com.eventhub.event.repository;

import com.eventhub.event.domain.MediaBlob;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MediaBlobRepository extends MongoRepository<MediaBlob, String> {
}
