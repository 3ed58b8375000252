package com.guardian.backend.service.advisor;

/**
 * Advisory oracle consulted once per stance during a debate.
 */
public interface PositionAdvisor {

    /**
     * @throws com.guardian.backend.exception.AdvisorException when no advice could be obtained
     */
    Advice advise(PositionContext context, DebateStance stance);
}
