/**
 * Domain list retrieval.
 * <p>Lists are JSON arrays of lower case domains fetched from local files or HTTP(S) URLs.
 */
package com.mimecast.wren.lists;
