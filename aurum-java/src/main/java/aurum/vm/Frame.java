package aurum.vm;

import aurum.bytecode.Value;

import java.util.List;

record Frame(String name, int returnAddress, List<Value> args) {
    Frame {
        args = List.copyOf(args);
    }

    @Override
    public String toString() {
        return name + "@" + returnAddress;
    }
}
