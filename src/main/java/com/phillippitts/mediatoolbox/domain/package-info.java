/**
 * Core value types shared by the job engine and the HTTP boundary: requests, progress events and
 * terminal outcomes.
 */
package com.phillippitts.mediatoolbox.domain;
