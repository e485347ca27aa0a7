package com.github.cowwoc.ratelimiter;

import com.github.cowwoc.ratelimiter.internal.CloseableLock;
import com.github.cowwoc.ratelimiter.internal.ReadWriteLockAsResource;
import com.github.cowwoc.ratelimiter.internal.ToStringBuilder;
import com.google.common.base.Ticker;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Decides whether a unit of work associated with a key may proceed, under a configured average rate and burst
 * capacity.
 * <p>
 * Each key is associated with its own token bucket. Buckets are created on first use with a full capacity of
 * tokens, are refilled lazily on every access and are evicted by a cleanup sweep that runs every
 * {@link #getCleanupEvery() cleanupEvery} accesses, once they have been idle for longer than
 * {@link #getExpiration() expiration}.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class RateLimiter
{
	private static final double NANOS_PER_SECOND = 1_000_000_000.0;

	private final double rate;
	private final double capacity;
	private final Duration expiration;
	private final long expirationInNanos;
	private final int cleanupEvery;
	private final Ticker ticker;
	private final List<BucketListener> listeners;
	private final ReadWriteLockAsResource lock = new ReadWriteLockAsResource();
	@GuardedBy("lock")
	private final Map<String, Bucket> keyToBucket = new HashMap<>();
	/**
	 * The number of accesses since the last cleanup sweep.
	 */
	@GuardedBy("lock")
	private int accessesSinceCleanup;
	private final Logger log = LoggerFactory.getLogger(RateLimiter.class);

	/**
	 * Creates a rate limiter that sweeps for expired buckets every {@code 100} accesses.
	 *
	 * @param rate       the number of tokens added to each bucket per second
	 * @param capacity   the maximum number of tokens that each bucket may hold
	 * @param expiration the amount of time after which an idle bucket may be evicted
	 * @return a new rate limiter
	 * @throws NullPointerException     if {@code expiration} is null
	 * @throws IllegalArgumentException if any of the arguments are negative or zero
	 */
	public static RateLimiter newRateLimiter(double rate, long capacity, Duration expiration)
	{
		return builder().
			rate(rate).
			capacity(capacity).
			expiration(expiration).
			build();
	}

	/**
	 * Builds a new rate limiter.
	 *
	 * @return a RateLimiter builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new rate limiter.
	 *
	 * @param rate         the number of tokens added to each bucket per second
	 * @param capacity     the maximum number of tokens that each bucket may hold
	 * @param expiration   the amount of time after which an idle bucket may be evicted
	 * @param cleanupEvery the number of accesses between cleanup sweeps
	 * @param ticker       the source of monotonic time
	 * @param listeners    the event listeners associated with this limiter
	 * @throws NullPointerException if {@code expiration}, {@code ticker} or {@code listeners} are null
	 */
	private RateLimiter(double rate, double capacity, Duration expiration, int cleanupEvery, Ticker ticker,
	                    List<BucketListener> listeners)
	{
		// Assume that all other preconditions are enforced by Builder
		assertThat(r ->
		{
			r.requireThat(expiration, "expiration").isNotNull();
			r.requireThat(ticker, "ticker").isNotNull();
			r.requireThat(listeners, "listeners").isNotNull();
		});
		this.rate = rate;
		this.capacity = capacity;
		this.expiration = expiration;
		this.expirationInNanos = toNanosSaturated(expiration);
		this.cleanupEvery = cleanupEvery;
		this.ticker = ticker;
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * @param duration a duration
	 * @return the duration in nanoseconds, or {@code Long.MAX_VALUE} if it is too long to be represented
	 */
	private static long toNanosSaturated(Duration duration)
	{
		try
		{
			return duration.toNanos();
		}
		catch (ArithmeticException e)
		{
			// Longer than ~292 years, which no ticker reading can ever exceed
			return Long.MAX_VALUE;
		}
	}

	/**
	 * Returns the number of tokens added to each bucket per second.
	 *
	 * @return the number of tokens added to each bucket per second
	 */
	public double getRate()
	{
		return rate;
	}

	/**
	 * Returns the maximum number of tokens that each bucket may hold. New buckets start out full.
	 *
	 * @return the maximum number of tokens that each bucket may hold
	 */
	public double getCapacity()
	{
		return capacity;
	}

	/**
	 * Returns the amount of time after which an idle bucket may be evicted.
	 *
	 * @return the amount of time after which an idle bucket may be evicted
	 */
	public Duration getExpiration()
	{
		return expiration;
	}

	/**
	 * Returns the number of accesses between cleanup sweeps.
	 *
	 * @return the number of accesses between cleanup sweeps
	 */
	public int getCleanupEvery()
	{
		return cleanupEvery;
	}

	/**
	 * Returns the event listeners associated with this limiter.
	 *
	 * @return an unmodifiable list
	 */
	public List<BucketListener> getListeners()
	{
		return listeners;
	}

	/**
	 * Consumes a single token from the bucket associated with {@code key}, if one is available.
	 *
	 * @param key the key (e.g. a user ID or IP address)
	 * @return true if the unit of work may proceed
	 * @throws NullPointerException if {@code key} is null
	 */
	@CheckReturnValue
	public boolean allow(String key)
	{
		return tryConsume(key, 1).isSuccessful();
	}

	/**
	 * Consumes {@code tokens} tokens from the bucket associated with {@code key}, only if they are all
	 * available. Either all of the tokens are consumed, or none are.
	 *
	 * @param key    the key (e.g. a user ID or IP address)
	 * @param tokens the number of tokens to consume
	 * @return true if the unit of work may proceed
	 * @throws NullPointerException     if {@code key} is null
	 * @throws IllegalArgumentException if {@code tokens} is negative or zero
	 */
	@CheckReturnValue
	public boolean allowN(String key, long tokens)
	{
		return tryConsume(key, tokens).isSuccessful();
	}

	/**
	 * Consumes {@code tokens} tokens from the bucket associated with {@code key}, only if they are all
	 * available.
	 *
	 * @param key    the key (e.g. a user ID or IP address)
	 * @param tokens the number of tokens to consume
	 * @return the result of the operation
	 * @throws NullPointerException     if {@code key} is null
	 * @throws IllegalArgumentException if {@code tokens} is negative or zero
	 */
	@CheckReturnValue
	public ConsumptionResult tryConsume(String key, long tokens)
	{
		requireThat(key, "key").isNotNull();
		requireThat(tokens, "tokens").isPositive();
		try (CloseableLock ignored = lock.writeLock())
		{
			long now = ticker.read();
			Bucket bucket = access(key, now);
			if (bucket.tokens >= tokens)
			{
				bucket.tokens -= tokens;
				return new ConsumptionResult(key, tokens, tokens, bucket.tokens, Duration.ZERO);
			}
			return new ConsumptionResult(key, tokens, 0, bucket.tokens, getTimeUntilAvailable(tokens,
				bucket.tokens));
		}
	}

	/**
	 * Returns the number of tokens available to {@code key}. The bucket is refilled (or created) as if it had
	 * been accessed by {@link #allow(String)}, but no tokens are consumed.
	 * <p>
	 * The returned value is a snapshot. Concurrent calls may consume tokens immediately after this method
	 * returns.
	 *
	 * @param key the key (e.g. a user ID or IP address)
	 * @return the number of available tokens
	 * @throws NullPointerException if {@code key} is null
	 */
	public double getTokens(String key)
	{
		requireThat(key, "key").isNotNull();
		try (CloseableLock ignored = lock.writeLock())
		{
			return access(key, ticker.read()).tokens;
		}
	}

	/**
	 * Discards the bucket associated with {@code key}. The next access will create a full bucket. Does nothing
	 * if the key does not have a bucket.
	 *
	 * @param key the key (e.g. a user ID or IP address)
	 * @throws NullPointerException if {@code key} is null
	 */
	public void resetKey(String key)
	{
		requireThat(key, "key").isNotNull();
		try (CloseableLock ignored = lock.writeLock())
		{
			if (keyToBucket.remove(key) == null)
				return;
			log.trace("Removed bucket for {}", key);
			for (BucketListener listener : listeners)
				listener.bucketRemoved(key, RemovalCause.EXPLICIT);
		}
	}

	/**
	 * Discards all buckets, returning the limiter to the state it was in when it was constructed.
	 */
	public void reset()
	{
		try (CloseableLock ignored = lock.writeLock())
		{
			List<String> removed = new ArrayList<>(keyToBucket.keySet());
			keyToBucket.clear();
			accessesSinceCleanup = 0;
			log.debug("Discarded {} bucket(s)", removed.size());
			for (String key : removed)
				for (BucketListener listener : listeners)
					listener.bucketRemoved(key, RemovalCause.RESET);
		}
	}

	/**
	 * Evicts all buckets that have been idle for longer than {@link #getExpiration() expiration}, without
	 * waiting for the next scheduled sweep.
	 *
	 * @return the number of buckets that were evicted
	 */
	public int cleanUp()
	{
		try (CloseableLock ignored = lock.writeLock())
		{
			return evictExpired(ticker.read());
		}
	}

	/**
	 * Returns the number of buckets held by this limiter. Buckets that have expired but have not been swept
	 * yet are included.
	 *
	 * @return the number of buckets held by this limiter
	 */
	public int size()
	{
		try (CloseableLock ignored = lock.readLock())
		{
			return keyToBucket.size();
		}
	}

	/**
	 * Indicates if a bucket exists for {@code key}. Unlike the other accessors, this method neither creates
	 * nor refills the bucket, and it does not extend the bucket's lifetime.
	 *
	 * @param key the key (e.g. a user ID or IP address)
	 * @return true if a bucket exists for {@code key}
	 * @throws NullPointerException if {@code key} is null
	 */
	public boolean contains(String key)
	{
		requireThat(key, "key").isNotNull();
		try (CloseableLock ignored = lock.readLock())
		{
			return keyToBucket.containsKey(key);
		}
	}

	/**
	 * Records an access to {@code key}, running the cleanup sweep if it is due, and returns the key's refilled
	 * bucket.
	 *
	 * @param key the key
	 * @param now the current time
	 * @return the bucket associated with {@code key}
	 */
	@GuardedBy("lock")
	private Bucket access(String key, long now)
	{
		assertThat(r -> r.requireThat(lock.isWriteLockedByCurrentThread(),
			"lock.isWriteLockedByCurrentThread()").isTrue());
		++accessesSinceCleanup;
		if (accessesSinceCleanup >= cleanupEvery)
			evictExpired(now);

		Bucket bucket = keyToBucket.get(key);
		if (bucket == null)
		{
			bucket = new Bucket(capacity, now);
			keyToBucket.put(key, bucket);
			log.trace("Created bucket for {}", key);
			for (BucketListener listener : listeners)
				listener.bucketCreated(key);
		}
		else
			refill(bucket, now);
		bucket.lastRequested = now;

		double tokens = bucket.tokens;
		assertThat(r -> r.requireThat(tokens, "tokens").isNotNegative().
			isLessThanOrEqualTo(capacity, "capacity"));
		return bucket;
	}

	/**
	 * Adds the tokens accumulated since the bucket was last refilled.
	 *
	 * @param bucket a bucket
	 * @param now    the current time
	 */
	private void refill(Bucket bucket, long now)
	{
		long elapsed = now - bucket.lastUpdated;
		// A ticker reading that precedes lastUpdated neither adds nor removes tokens
		if (elapsed <= 0)
			return;
		bucket.tokens = Math.min(capacity, bucket.tokens + elapsed / NANOS_PER_SECOND * rate);
		bucket.lastUpdated = now;
	}

	/**
	 * @param tokensRequested the number of tokens that were requested
	 * @param tokensLeft      the number of tokens in the bucket
	 * @return the amount of time until {@code tokensRequested} tokens will be available, or {@code null} if
	 * the bucket can never hold that many tokens
	 */
	private Duration getTimeUntilAvailable(long tokensRequested, double tokensLeft)
	{
		if (tokensRequested > capacity)
			return null;
		double secondsNeeded = (tokensRequested - tokensLeft) / rate;
		// Casting a double that is too large saturates to Long.MAX_VALUE
		long nanosNeeded = (long) Math.ceil(secondsNeeded * NANOS_PER_SECOND);
		return Duration.ofNanos(Math.max(1, nanosNeeded));
	}

	/**
	 * Removes buckets that have been idle for longer than {@code expiration} and resets the access counter.
	 *
	 * @param now the current time
	 * @return the number of buckets that were evicted
	 */
	@GuardedBy("lock")
	private int evictExpired(long now)
	{
		accessesSinceCleanup = 0;
		List<String> evicted = new ArrayList<>();
		for (Iterator<Entry<String, Bucket>> i = keyToBucket.entrySet().iterator(); i.hasNext(); )
		{
			Entry<String, Bucket> entry = i.next();
			if (now - entry.getValue().lastRequested > expirationInNanos)
			{
				i.remove();
				evicted.add(entry.getKey());
			}
		}
		if (!evicted.isEmpty())
			log.debug("Evicted {} expired bucket(s), {} remaining", evicted.size(), keyToBucket.size());
		// Notify after iterating so that listeners may safely access this limiter
		for (String key : evicted)
			for (BucketListener listener : listeners)
				listener.bucketRemoved(key, RemovalCause.EXPIRED);
		return evicted.size();
	}

	@Override
	public String toString()
	{
		ToStringBuilder builder = new ToStringBuilder(RateLimiter.class).
			add("rate", rate).
			add("capacity", capacity).
			add("expiration", expiration).
			add("cleanupEvery", cleanupEvery);
		try (CloseableLock ignored = lock.readLock())
		{
			builder.add("buckets", keyToBucket.size());
			if (log.isDebugEnabled())
				builder.add("keyToBucket", keyToBucket);
		}
		return builder.toString();
	}

	/**
	 * Builds a rate limiter.
	 */
	public static final class Builder
	{
		private double rate = 1;
		private double capacity = 1;
		private Duration expiration = Duration.ofMinutes(10);
		private int cleanupEvery = 100;
		private Ticker ticker = Ticker.systemTicker();
		private final List<BucketListener> listeners = new ArrayList<>();

		/**
		 * Prevent construction.
		 */
		private Builder()
		{
		}

		/**
		 * Returns the number of tokens added to each bucket per second. The default is {@code 1}.
		 *
		 * @return the number of tokens added to each bucket per second
		 */
		@CheckReturnValue
		public double rate()
		{
			return rate;
		}

		/**
		 * Sets the number of tokens added to each bucket per second.
		 *
		 * @param rate the number of tokens added to each bucket per second
		 * @return this
		 * @throws IllegalArgumentException if {@code rate} is negative, zero, infinite or {@code NaN}
		 */
		public Builder rate(double rate)
		{
			requireThat(Double.isFinite(rate), "Double.isFinite(rate)").isTrue();
			requireThat(rate, "rate").isPositive();
			this.rate = rate;
			return this;
		}

		/**
		 * Returns the maximum number of tokens that each bucket may hold. The default is {@code 1}.
		 *
		 * @return the maximum number of tokens that each bucket may hold
		 */
		@CheckReturnValue
		public double capacity()
		{
			return capacity;
		}

		/**
		 * Sets the maximum number of tokens that each bucket may hold. New buckets start out full, so this is
		 * also the largest burst that a key may consume at once.
		 *
		 * @param capacity the maximum number of tokens that each bucket may hold
		 * @return this
		 * @throws IllegalArgumentException if {@code capacity} is negative, zero, infinite or {@code NaN}
		 */
		public Builder capacity(double capacity)
		{
			requireThat(Double.isFinite(capacity), "Double.isFinite(capacity)").isTrue();
			requireThat(capacity, "capacity").isPositive();
			this.capacity = capacity;
			return this;
		}

		/**
		 * Returns the amount of time after which an idle bucket may be evicted. The default is
		 * {@code 10 minutes}.
		 *
		 * @return the amount of time after which an idle bucket may be evicted
		 */
		@CheckReturnValue
		public Duration expiration()
		{
			return expiration;
		}

		/**
		 * Sets the amount of time after which an idle bucket may be evicted.
		 *
		 * @param expiration the amount of time after which an idle bucket may be evicted
		 * @return this
		 * @throws NullPointerException     if {@code expiration} is null
		 * @throws IllegalArgumentException if {@code expiration} is negative or zero
		 */
		public Builder expiration(Duration expiration)
		{
			requireThat(expiration, "expiration").isGreaterThan(Duration.ZERO);
			this.expiration = expiration;
			return this;
		}

		/**
		 * Returns the number of accesses between cleanup sweeps. The default is {@code 100}.
		 *
		 * @return the number of accesses between cleanup sweeps
		 */
		@CheckReturnValue
		public int cleanupEvery()
		{
			return cleanupEvery;
		}

		/**
		 * Sets the number of accesses between cleanup sweeps. Accesses to any key count towards the total.
		 *
		 * @param cleanupEvery the number of accesses between cleanup sweeps
		 * @return this
		 * @throws IllegalArgumentException if {@code cleanupEvery} is negative or zero
		 */
		public Builder cleanupEvery(int cleanupEvery)
		{
			requireThat(cleanupEvery, "cleanupEvery").isPositive();
			this.cleanupEvery = cleanupEvery;
			return this;
		}

		/**
		 * Returns the source of monotonic time. The default is {@link Ticker#systemTicker()}.
		 *
		 * @return the source of monotonic time
		 */
		@CheckReturnValue
		public Ticker ticker()
		{
			return ticker;
		}

		/**
		 * Sets the source of monotonic time.
		 *
		 * @param ticker the source of monotonic time
		 * @return this
		 * @throws NullPointerException if {@code ticker} is null
		 */
		public Builder ticker(Ticker ticker)
		{
			requireThat(ticker, "ticker").isNotNull();
			this.ticker = ticker;
			return this;
		}

		/**
		 * Returns the event listeners associated with the limiter.
		 *
		 * @return the event listeners associated with the limiter
		 */
		@CheckReturnValue
		public List<BucketListener> listeners()
		{
			return listeners;
		}

		/**
		 * Adds an event listener to the limiter.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		public Builder addListener(BucketListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			listeners.add(listener);
			return this;
		}

		/**
		 * Builds a new RateLimiter.
		 *
		 * @return a new RateLimiter
		 */
		public RateLimiter build()
		{
			return new RateLimiter(rate, capacity, expiration, cleanupEvery, ticker, listeners);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("rate", rate).
				add("capacity", capacity).
				add("expiration", expiration).
				add("cleanupEvery", cleanupEvery).
				add("ticker", ticker).
				add("listeners", listeners).
				toString();
		}
	}
}
