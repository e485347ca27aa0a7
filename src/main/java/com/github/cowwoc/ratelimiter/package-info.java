/**
 * A per-key implementation of the <a href="https://en.wikipedia.org/wiki/Token_bucket">Token bucket
 * algorithm</a>, suitable for admission control of users, API clients or IP addresses.
 * <p>
 * Buckets are created lazily on first use, refilled lazily on every access and evicted once they have been
 * idle for longer than the limiter's expiration.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.cowwoc.ratelimiter.RateLimiter}).
 */
package com.github.cowwoc.ratelimiter;
