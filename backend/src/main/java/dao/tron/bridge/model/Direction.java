package dao.tron.bridge.model;

public enum Direction {
    LOCK,
    RELEASE
}
