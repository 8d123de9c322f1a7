package com.koni.energy.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Plain {@code {"message": ...}} body for operations without a resource to return.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ApiMessage {

    private String message;
}
