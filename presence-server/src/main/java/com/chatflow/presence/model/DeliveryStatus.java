package com.chatflow.presence.model;

public enum DeliveryStatus {
    DELIVERED, READ
}
