package com.hamclock.rigdaemon.adapter.flrig;

import org.apache.xmlrpc.XmlRpcException;

/**
 * Blocking XML-RPC call into flrig.
 */
@FunctionalInterface
public interface FlrigClient {

    /**
     * @return the decoded XML-RPC result (String, Integer, Double, Boolean or Object[])
     * @throws XmlRpcException on a fault response or transport failure
     */
    Object call(String method, Object... params) throws XmlRpcException;
}
