package com.example.filmarchive.infrastructure.status;

import com.example.filmarchive.domain.model.StatusUpdate;

/**
 * Receives a stage transition of the file currently being processed. Delivery is best effort.
 */
public interface StatusSink {

    void publish(StatusUpdate update);
}
