package com.ibprovider.connector;

import java.util.List;

public interface IbConnector {
  /**
   * Fetches objects of the given type.
   *
   * @param object object type and the fields to return
   * @param ref object reference to fetch directly, or an empty string to search
   * @param queryParams search fields applied when {@code ref} is empty
   * @return decoded objects, or {@code null} when WAPI answered with no result set
   * @throws WapiException on transport failure or WAPI error response
   */
  <T> List<T> getObject(IbObject<T> object, String ref, QueryParams queryParams);
}
