package com.github.cowwoc.ratelimiter;

import com.github.cowwoc.ratelimiter.internal.ToStringBuilder;

/**
 * The accumulated capacity of a single key.
 * <p>
 * Timestamps are {@link com.google.common.base.Ticker} readings, in nanoseconds. They are only meaningful
 * relative to other readings of the same ticker.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe. Instances are guarded by the lock of the
 * {@link RateLimiter} that owns them.
 */
final class Bucket
{
	/**
	 * The number of available tokens, between zero and the limiter's capacity (inclusive).
	 */
	double tokens;
	/**
	 * The last time that {@code tokens} was recomputed.
	 */
	long lastUpdated;
	/**
	 * The last time that the key was accessed. Used to determine whether the bucket has expired.
	 */
	long lastRequested;

	/**
	 * Creates a new bucket.
	 *
	 * @param tokens    the initial number of tokens
	 * @param createdAt the time at which the bucket was created
	 */
	Bucket(double tokens, long createdAt)
	{
		this.tokens = tokens;
		this.lastUpdated = createdAt;
		this.lastRequested = createdAt;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Bucket.class).
			add("tokens", tokens).
			add("lastUpdated", lastUpdated).
			add("lastRequested", lastRequested).
			toString();
	}
}
