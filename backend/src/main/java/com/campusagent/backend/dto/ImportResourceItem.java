package com.campusagent.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One resource inside a categorized import file.
 * The description is carried in {@code text}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResourceItem {

    private String title;
    private String text;
    private String url;
}
