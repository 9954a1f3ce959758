package org.apirepository.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * HTTP header sent with every request; the value is a FreeMarker template.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiHeader {
    private String key;
    private String value;
}
