package com.orderly.orderservice.shipment;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class ParsedAddress {
    private final String city;
    private final String district; // "" when none was recognised
    private final String ward;     // never recognised, always ""
}
