/**
 * items.xml attribute schemas, one per TFS server dialect.
 *
 * <p>Schemas are bundled as JSON resources and are immutable once loaded.
 */
package io.serveritems.attributes;
