package com.example.documentdb.core;

/**
 * @param count number of matching documents
 * @param requestCharge request units charged over all pages
 * @param sessionToken session token of the last page, or null
 */
public record CountResponse(long count, double requestCharge, String sessionToken) {}
