package com.example.media_acquisition.service.backend;

import com.example.media_acquisition.util.BackendErrorClass;

@FunctionalInterface
public interface ErrorClassifier {
    BackendErrorClass classify(Throwable error);
}
