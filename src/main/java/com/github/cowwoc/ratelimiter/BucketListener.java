package com.github.cowwoc.ratelimiter;

/**
 * Listens for bucket lifecycle events.
 * <p>
 * The listener is invoked on the calling thread while holding the limiter's lock, so it must return quickly
 * and special care must be taken to avoid deadlocks. Exceptions thrown by the listener propagate to the caller
 * of the operation that triggered the event.
 */
public interface BucketListener
{
	/**
	 * Invoked after a bucket is created for a key that did not have one.
	 *
	 * @param key the key
	 */
	default void bucketCreated(String key)
	{
	}

	/**
	 * Invoked after a bucket is removed.
	 *
	 * @param key   the key
	 * @param cause the reason that the bucket was removed
	 */
	default void bucketRemoved(String key, RemovalCause cause)
	{
	}
}
