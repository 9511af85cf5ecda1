package com.sumeet.later.urlshortener.dto;

import com.sumeet.later.urlshortener.model.UrlMapping;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

/**
 * One page of an owner's live mappings, newest first.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PaginatedMappingsResponse implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<UrlMapping> urls;
    private int totalPages;
}
