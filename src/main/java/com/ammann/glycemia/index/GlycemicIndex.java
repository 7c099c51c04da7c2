/* (C)2026 */
package com.ammann.glycemia.index;

import java.util.OptionalDouble;

/**
 * A glycemic variability index bound to one series and one configuration.
 *
 * <p>Implementations are stateless between calls: {@link #calculate()} may be invoked any
 * number of times, never mutates the bound series or configuration, and always returns
 * the same result. An empty result means the statistic is mathematically undefined for
 * the input (e.g. all readings missing); a present result is always finite.
 *
 * <p>Parameterized indices expose additional {@code calculate(...)} overloads taking
 * explicit arguments. The no-argument form evaluates them with the defaults of the
 * bound configuration.
 */
@FunctionalInterface
public interface GlycemicIndex
{
    OptionalDouble calculate();
}
