package com.whereq.forge.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.forge.model.JobType;

/**
 * Type-specific generation parameters. One subclass per {@link JobType};
 * the submission boundary binds raw JSON to the subclass selected by the job type.
 */
public abstract class GenerationPayload {

    @JsonIgnore
    public abstract JobType getType();
}
