/**
 * Projection of client appearance data ({@link io.serveritems.sync.ThingType}) onto server items.
 *
 * <p>{@link io.serveritems.sync.OtbSync} owns the flag mapping used both to update items and to detect drift;
 * {@link io.serveritems.sync.SpriteHash} derives the MD5 sprite identity stored in OTB.
 */
package io.serveritems.sync;
