package com.voltquery.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Index one zip code or state. {@code limit} applies to stations only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {
    private String location;
    private Integer limit;
}
