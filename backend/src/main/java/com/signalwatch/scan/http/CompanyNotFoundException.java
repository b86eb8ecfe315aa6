package com.signalwatch.scan.http;

public class CompanyNotFoundException extends RegistryException {
    public CompanyNotFoundException(String message) {
        super(message);
    }
}
