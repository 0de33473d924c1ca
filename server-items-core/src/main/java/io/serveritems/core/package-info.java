/**
 * In-memory model for server item databases.
 *
 * <p>This module has no knowledge of file formats. It contains:
 * <ul>
 *   <li>The {@link io.serveritems.core.ServerItem} entity and its enums</li>
 *   <li>{@link io.serveritems.core.ServerItemList}, the id and client id index</li>
 *   <li>Small primitives shared by the codecs and the sync engine (MD5, LRU cache)</li>
 * </ul>
 *
 * <p>OTB and items.xml codecs live in other modules.
 */
package io.serveritems.core;
