package com.example.hybridretrieval.domain.model;

public enum SearchChannel {
    VECTOR,
    KEYWORD
}
