package com.github.cowwoc.ratelimiter;

import com.github.cowwoc.ratelimiter.internal.ToStringBuilder;

import java.time.Duration;
import java.util.Objects;

import static com.github.cowwoc.requirements.DefaultRequirements.assertionsAreEnabled;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * The result of an attempt to consume tokens.
 */
public final class ConsumptionResult
{
	private final String key;
	private final long tokensRequested;
	private final long tokensConsumed;
	private final double tokensLeft;
	private final Duration availableIn;

	/**
	 * Creates a result of a request to consume tokens.
	 *
	 * @param key             the key whose bucket was consumed from
	 * @param tokensRequested the number of tokens that were requested
	 * @param tokensConsumed  the number of tokens that were consumed ({@code 0} or {@code tokensRequested})
	 * @param tokensLeft      the number of tokens left in the bucket after the attempt
	 * @param availableIn     the amount of time until the requested tokens are expected to become available
	 *                        ({@code Duration.ZERO} if tokens were consumed, {@code null} if the request exceeds
	 *                        the bucket's capacity)
	 * @throws NullPointerException     if {@code key} is null
	 * @throws IllegalArgumentException if {@code tokensRequested} is negative or zero. If
	 *                                  {@code tokensConsumed} is neither zero nor {@code tokensRequested}. If
	 *                                  {@code tokensLeft} is negative. If {@code availableIn} is negative, or
	 *                                  non-zero even though tokens were consumed.
	 */
	ConsumptionResult(String key, long tokensRequested, long tokensConsumed, double tokensLeft,
	                  Duration availableIn)
	{
		if (assertionsAreEnabled())
		{
			requireThat(key, "key").isNotNull();
			requireThat(tokensRequested, "tokensRequested").isPositive();
			if (tokensConsumed != 0)
				requireThat(tokensConsumed, "tokensConsumed").isEqualTo(tokensRequested, "tokensRequested");
			requireThat(tokensLeft, "tokensLeft").isNotNegative();
			if (tokensConsumed > 0)
				requireThat(availableIn, "availableIn").isEqualTo(Duration.ZERO);
			else if (availableIn != null)
				requireThat(availableIn, "availableIn").isGreaterThan(Duration.ZERO);
		}
		this.key = key;
		this.tokensRequested = tokensRequested;
		this.tokensConsumed = tokensConsumed;
		this.tokensLeft = tokensLeft;
		this.availableIn = availableIn;
	}

	/**
	 * Returns the key whose bucket was consumed from.
	 *
	 * @return the key whose bucket was consumed from
	 */
	public String getKey()
	{
		return key;
	}

	/**
	 * Returns the number of tokens that were requested.
	 *
	 * @return the number of tokens that were requested
	 */
	public long getTokensRequested()
	{
		return tokensRequested;
	}

	/**
	 * Returns the number of tokens that were consumed by the request.
	 *
	 * @return {@code 0} if the request was denied
	 */
	public long getTokensConsumed()
	{
		return tokensConsumed;
	}

	/**
	 * Returns true if the requested tokens were consumed.
	 *
	 * @return true if the requested tokens were consumed
	 */
	public boolean isSuccessful()
	{
		return tokensConsumed > 0;
	}

	/**
	 * Returns the number of tokens left in the bucket after the attempt.
	 *
	 * @return the number of tokens left in the bucket after the attempt
	 */
	public double getTokensLeft()
	{
		return tokensLeft;
	}

	/**
	 * Returns the amount of time until the requested number of tokens will become available, assuming that
	 * no other request consumes them in the meantime.
	 *
	 * @return {@code Duration.ZERO} if tokens were consumed; {@code null} if the request exceeds the bucket's
	 * capacity and can never succeed
	 */
	public Duration getAvailableIn()
	{
		return availableIn;
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof ConsumptionResult other))
			return false;
		return other.key.equals(key) && other.tokensRequested == tokensRequested &&
			other.tokensConsumed == tokensConsumed &&
			Double.compare(other.tokensLeft, tokensLeft) == 0 && Objects.equals(other.availableIn, availableIn);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(key, tokensRequested, tokensConsumed, tokensLeft, availableIn);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(ConsumptionResult.class).
			add("successful", isSuccessful()).
			add("key", key).
			add("tokensRequested", tokensRequested).
			add("tokensConsumed", tokensConsumed).
			add("tokensLeft", tokensLeft).
			add("availableIn", availableIn).
			toString();
	}
}
