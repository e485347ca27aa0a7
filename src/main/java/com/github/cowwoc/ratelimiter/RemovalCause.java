package com.github.cowwoc.ratelimiter;

/**
 * The reason that a bucket was removed from a {@link RateLimiter}.
 */
public enum RemovalCause
{
	/**
	 * The bucket was removed by {@link RateLimiter#resetKey(String)}.
	 */
	EXPLICIT,
	/**
	 * The bucket was removed by {@link RateLimiter#reset()}.
	 */
	RESET,
	/**
	 * The bucket was idle for longer than the limiter's expiration and was removed by a cleanup sweep.
	 */
	EXPIRED
}
