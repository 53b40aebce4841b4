package com.shopledger.checkout.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지 주소 (입력값 그대로 저장, 형식 검증은 하지 않음)
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Address {

    @Column(name = "first_name", length = 256)
    private String firstName;

    @Column(name = "last_name", length = 256)
    private String lastName;

    @Column(name = "company_name", length = 256)
    private String companyName;

    @Column(name = "street_address_1", length = 256)
    private String streetAddress1;

    @Column(name = "street_address_2", length = 256)
    private String streetAddress2;

    @Column(name = "city", length = 256)
    private String city;

    @Column(name = "city_area", length = 128)
    private String cityArea;

    @Column(name = "postal_code", length = 20)
    private String postalCode;

    @Column(name = "country", length = 2)
    private String country;

    @Column(name = "country_area", length = 128)
    private String countryArea;

    @Column(name = "phone", length = 128)
    private String phone;
}
