package com.github.cowwoc.ratelimiter.internal;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.StringJoiner;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Standardizes the format of toString() return values.
 * <p>
 * Output takes the form:
 * <pre>
 * ClassName
 * {
 * 	first : value,
 * 	second: value
 * }
 * </pre>
 */
public final class ToStringBuilder
{
	private final String name;
	private final List<Entry<String, String>> properties = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being processed
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		requireThat(aClass, "aClass").isNotNull();
		this.name = getQualifiedSimpleName(aClass);
	}

	/**
	 * Creates a new builder without an object type.
	 */
	public ToStringBuilder()
	{
		this.name = "";
	}

	/**
	 * @param aClass a class
	 * @return the simple names of {@code aClass} and its enclosing classes, separated by dots (e.g.
	 * {@code RateLimiter.Builder})
	 */
	private static String getQualifiedSimpleName(Class<?> aClass)
	{
		Deque<String> names = new ArrayDeque<>();
		for (Class<?> current = aClass; current != null; current = current.getEnclosingClass())
			names.push(current.getSimpleName());
		return String.join(".", names);
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		if (value instanceof Collection<?> collection)
			return add(name, collection);
		if (value instanceof Map<?, ?> map)
			return add(name, map);
		requireThat(name, "name").isNotBlank();
		properties.add(new SimpleImmutableEntry<>(name, String.valueOf(value)));
		return this;
	}

	/**
	 * Adds a property.
	 *
	 * @param name       the name of the property
	 * @param collection the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} or {@code collection} are null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Collection<?> collection)
	{
		requireThat(name, "name").isNotBlank();
		StringJoiner joiner = new StringJoiner(", ", "[", "]");
		for (Object element : collection)
			joiner.add(String.valueOf(element));
		properties.add(new SimpleImmutableEntry<>(name, joiner.toString()));
		return this;
	}

	/**
	 * Adds a property whose value is rendered as a nested block. Map keys are rendered in double quotes, so
	 * blank keys remain visible.
	 *
	 * @param name the name of the property
	 * @param map  the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} or {@code map} are null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Map<?, ?> map)
	{
		requireThat(name, "name").isNotBlank();
		ToStringBuilder entries = new ToStringBuilder();
		for (Entry<?, ?> entry : map.entrySet())
			entries.add("\"" + entry.getKey() + "\"", entry.getValue());
		properties.add(new SimpleImmutableEntry<>(name, entries.toString()));
		return this;
	}

	/**
	 * Returns the String representation of this {@code ToStringBuilder}.
	 *
	 * @return the String representation of this {@code ToStringBuilder}
	 */
	@Override
	public String toString()
	{
		int keyWidth = 0;
		for (Entry<String, String> entry : properties)
			keyWidth = Math.max(keyWidth, entry.getKey().length());

		StringJoiner body = new StringJoiner(",\n");
		for (Entry<String, String> entry : properties)
		{
			String key = entry.getKey();
			String padding = " ".repeat(keyWidth - key.length());
			body.add(key + padding + ": " + entry.getValue());
		}
		return name + "\n" +
			"{\n" +
			"\t" + body.toString().replace("\n", "\n\t") + "\n" +
			"}";
	}
}
