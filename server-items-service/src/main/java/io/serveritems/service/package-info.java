/**
 * Session facade tying the OTB codec, the items.xml codec, the attribute schemas and the sync engine together.
 */
package io.serveritems.service;
