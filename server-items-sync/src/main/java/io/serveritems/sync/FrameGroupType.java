package io.serveritems.sync;

public enum FrameGroupType {
    DEFAULT,
    WALKING
}
