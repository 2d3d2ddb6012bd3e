package com.mimecast.wren.lists;

import com.mimecast.wren.error.ValidatorException;

import java.util.List;

/**
 * Domain list source.
 * <p>Fetches a list of domains in full or fails without a partial result.
 *
 * @see UriListSource
 */
public interface ListSource {

    /**
     * Fetches list at URI.
     *
     * @param uri List URI string.
     * @return Ordered list of domain strings.
     * @throws ValidatorException With {@link com.mimecast.wren.error.ErrorKind#LIST_LOAD_FAILURE}.
     */
    List<String> fetch(String uri) throws ValidatorException;
}
