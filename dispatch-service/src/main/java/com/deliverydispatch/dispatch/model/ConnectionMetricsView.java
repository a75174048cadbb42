package com.deliverydispatch.dispatch.model;

import com.deliverydispatch.shared.enums.UserRole;

import java.util.Map;

public record ConnectionMetricsView(int activeConnections, int onlineUsers, Map<UserRole, Integer> connectionsByRole) {
}
