package io.pulse4j;

import io.pulse4j.core.QueueJob;
import io.pulse4j.core.QueueJobType;

/**
 * Executes one kind of queue job. The raw {@code data} map is converted to {@link #payloadClass()}
 * before {@link #execute} is called.
 *
 * <p>Returning normally completes the job; throwing routes it through the retry policy.
 */
public interface QueueJobHandler<T> {

    QueueJobType type();

    Class<T> payloadClass();

    void execute(QueueJob job, T payload) throws Exception;
}
