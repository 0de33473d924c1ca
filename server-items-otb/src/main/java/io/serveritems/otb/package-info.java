/**
 * OTB binary tree codec.
 *
 * <p>{@link io.serveritems.otb.BinaryTreeReader} and {@link io.serveritems.otb.BinaryTreeWriter} handle the
 * node framing and escaping; {@link io.serveritems.otb.OtbReader} and {@link io.serveritems.otb.OtbWriter}
 * map nodes to {@link io.serveritems.core.ServerItemList} contents.
 */
package io.serveritems.otb;
