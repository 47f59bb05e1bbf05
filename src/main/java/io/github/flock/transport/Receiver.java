package io.github.flock.transport;

import io.github.flock.protobuf.Rumors;
import io.github.flock.protobuf.Swim;

public interface Receiver {

    void onSwim(Swim swim);

    void onRumors(Rumors rumors);

}
