package com.github.cowwoc.ratelimiter.internal;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Enables the use of try-with-resources with a {@code ReentrantReadWriteLock}.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class ReadWriteLockAsResource
{
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	/**
	 * Acquires the read lock, blocking until it becomes available.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock readLock()
	{
		Lock readLock = lock.readLock();
		readLock.lock();
		return readLock::unlock;
	}

	/**
	 * Acquires the write lock, blocking until it becomes available.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock writeLock()
	{
		Lock writeLock = lock.writeLock();
		writeLock.lock();
		return writeLock::unlock;
	}

	/**
	 * @return true if the current thread holds the write lock
	 */
	public boolean isWriteLockedByCurrentThread()
	{
		return lock.isWriteLockedByCurrentThread();
	}
}
