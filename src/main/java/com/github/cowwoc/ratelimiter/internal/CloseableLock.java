package com.github.cowwoc.ratelimiter.internal;

/**
 * A lock that is released by {@code try-with-resources}.
 * <p>
 * Unlike {@link AutoCloseable#close()}, releasing the lock does not throw any exceptions.
 */
@FunctionalInterface
public interface CloseableLock extends AutoCloseable
{
	/**
	 * Releases the lock.
	 */
	@Override
	void close();
}
