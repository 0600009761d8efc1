package com.orderly.orderservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerDto {

    @Size(max = 50, message = "Customer ID must be at most 50 characters")
    private String customerId;

    @NotBlank(message = "Customer name is required")
    private String name;

    @NotBlank(message = "Customer phone is required")
    @Size(max = 30, message = "Customer phone must be at most 30 characters")
    private String phone;

    @Email(message = "Customer email must be a valid email address")
    private String email;
}
