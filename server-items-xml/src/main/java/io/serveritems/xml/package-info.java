/**
 * items.xml reader and writer.
 *
 * <p>Both sides take their dialect-dependent settings from option objects, usually built from an
 * {@link io.serveritems.attributes.AttributeSchema} with {@code forSchema}.
 */
package io.serveritems.xml;
