/**
 * <h1>Locking policy</h1>
 * <p>
 * Public methods of {@link com.github.cowwoc.ratelimiter.RateLimiter} acquire the limiter's lock on behalf of
 * the non-public methods that they invoke. Operations that may create, refill or remove buckets acquire the
 * write lock. Operations that only inspect the set of buckets acquire the read lock.
 * <p>
 * Classes in this package are not part of the public API.
 */
package com.github.cowwoc.ratelimiter.internal;
