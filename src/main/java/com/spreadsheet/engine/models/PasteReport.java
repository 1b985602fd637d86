package com.spreadsheet.engine.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a paste: which destination cells were written and which were refused, with why.
 */
public final class PasteReport {

    public static final class Rejection {
        private final Address address;
        private final String reason;

        public Rejection(Address address, String reason) {
            this.address = address;
            this.reason = reason;
        }

        public Address getAddress() {
            return address;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return address + ": " + reason;
        }
    }

    private final List<Address> pasted = new ArrayList<>();
    private final List<Rejection> rejections = new ArrayList<>();

    public void addPasted(Address address) {
        pasted.add(address);
    }

    public void addRejection(Address address, String reason) {
        rejections.add(new Rejection(address, reason));
    }

    public List<Address> getPasted() {
        return Collections.unmodifiableList(pasted);
    }

    public List<Rejection> getRejections() {
        return Collections.unmodifiableList(rejections);
    }

    public boolean isComplete() {
        return rejections.isEmpty();
    }
}
