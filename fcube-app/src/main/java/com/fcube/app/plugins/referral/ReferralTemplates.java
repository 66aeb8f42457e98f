package com.fcube.app.plugins.referral;

/**
 * Python sources written by the referral plugin.
 */
final class ReferralTemplates {

    private ReferralTemplates() {
    }

    static String packageInit() {
        return """
                \"""Referral module: tracks who referred whom and when a referral completes.\"""

                from app.referral.models import Referral, ReferralEvent, ReferralSettings, ReferralStatus

                __all__ = ["Referral", "ReferralEvent", "ReferralSettings", "ReferralStatus"]
                """;
    }

    static String models() {
        return """
                \"""Referral system models for tracking user referrals and milestones.\"""

                from datetime import datetime, timezone
                from enum import Enum
                from typing import Optional
                from uuid import UUID as UUIDType, uuid4

                from sqlalchemy import JSON, CheckConstraint, DateTime, ForeignKey, Index, String
                from sqlalchemy import Enum as SQLEnum
                from sqlalchemy.dialects.postgresql import UUID
                from sqlalchemy.orm import Mapped, mapped_column

                from app.core.database import Base


                def utc_now():
                    return datetime.now(timezone.utc)


                class ReferralStatus(str, Enum):
                    PENDING = "pending"
                    COMPLETED = "completed"
                    CANCELLED = "cancelled"


                class Referral(Base):
                    __tablename__ = "referrals"
                    __table_args__ = (
                        Index("ix_referral_referrer_id", "referrer_id"),
                        Index("ix_referral_status", "status"),
                        CheckConstraint("referrer_id != referred_user_id", name="check_no_self_referral"),
                    )

                    id: Mapped[UUIDType] = mapped_column(UUID(as_uuid=True), primary_key=True, default=uuid4)
                    referrer_id: Mapped[UUIDType] = mapped_column(
                        UUID(as_uuid=True), ForeignKey("users.id", ondelete="CASCADE"))
                    referred_user_id: Mapped[UUIDType] = mapped_column(
                        UUID(as_uuid=True), ForeignKey("users.id", ondelete="CASCADE"), unique=True)
                    referred_user_type: Mapped[str] = mapped_column(String(50))
                    referral_code: Mapped[str] = mapped_column(String(20))
                    status: Mapped[ReferralStatus] = mapped_column(
                        SQLEnum(ReferralStatus), default=ReferralStatus.PENDING)
                    completed_at: Mapped[Optional[datetime]] = mapped_column(DateTime(timezone=True), nullable=True)
                    created_at: Mapped[datetime] = mapped_column(DateTime(timezone=True), default=utc_now)


                class ReferralEvent(Base):
                    __tablename__ = "referral_events"

                    id: Mapped[UUIDType] = mapped_column(UUID(as_uuid=True), primary_key=True, default=uuid4)
                    referral_id: Mapped[UUIDType] = mapped_column(
                        UUID(as_uuid=True), ForeignKey("referrals.id", ondelete="CASCADE"))
                    event_type: Mapped[str] = mapped_column(String(50))
                    payload: Mapped[Optional[dict]] = mapped_column(JSON, nullable=True)
                    created_at: Mapped[datetime] = mapped_column(DateTime(timezone=True), default=utc_now)


                class ReferralSettings(Base):
                    __tablename__ = "referral_settings"

                    id: Mapped[UUIDType] = mapped_column(UUID(as_uuid=True), primary_key=True, default=uuid4)
                    user_type: Mapped[str] = mapped_column(String(50), unique=True)
                    completion_event: Mapped[str] = mapped_column(String(50))
                    required_count: Mapped[int] = mapped_column(default=1)
                """;
    }

    static String config() {
        return """
                \"""Maps user types to their referral completion strategies.\"""

                from typing import Dict, Optional

                from app.referral.strategies import (
                    CustomerFirstOrderStrategy,
                    ProviderFirstServiceStrategy,
                    ReferralCompletionStrategy,
                )

                REFERRAL_CODE_LENGTH = 8


                def get_referral_strategies() -> Dict[str, ReferralCompletionStrategy]:
                    return {
                        "customer": CustomerFirstOrderStrategy(),
                        "provider": ProviderFirstServiceStrategy(),
                    }


                def get_strategy_for_user_type(user_type: str) -> Optional[ReferralCompletionStrategy]:
                    return get_referral_strategies().get(user_type)
                """;
    }

    static String strategies() {
        return """
                \"""Completion strategies decide when a referral counts as successful.\"""

                from abc import ABC, abstractmethod
                from typing import Any, Dict


                class ReferralCompletionStrategy(ABC):
                    @abstractmethod
                    def completion_event(self) -> str:
                        ...

                    def is_complete(self, event_type: str, payload: Dict[str, Any]) -> bool:
                        return event_type == self.completion_event()


                class CustomerFirstOrderStrategy(ReferralCompletionStrategy):
                    def completion_event(self) -> str:
                        return "booking_completed"


                class ProviderFirstServiceStrategy(ReferralCompletionStrategy):
                    def completion_event(self) -> str:
                        return "service_completed"
                """;
    }

    static String exceptions() {
        return """
                \"""HTTP errors raised by the referral module.\"""

                from fastapi import HTTPException, status


                class ReferralException(HTTPException):
                    pass


                class ReferralNotFoundError(ReferralException):
                    def __init__(self):
                        super().__init__(status_code=status.HTTP_404_NOT_FOUND, detail="Referral not found")


                class InvalidReferralCodeError(ReferralException):
                    def __init__(self):
                        super().__init__(status_code=status.HTTP_400_BAD_REQUEST, detail="Invalid referral code")


                class SelfReferralError(ReferralException):
                    def __init__(self):
                        super().__init__(status_code=status.HTTP_400_BAD_REQUEST, detail="Users cannot refer themselves")


                class DuplicateReferralError(ReferralException):
                    def __init__(self):
                        super().__init__(status_code=status.HTTP_409_CONFLICT, detail="User was already referred")
                """;
    }

    static String dependencies() {
        return """
                \"""FastAPI dependency providing the referral service.\"""

                from typing import Optional

                from app.referral.config import get_referral_strategies
                from app.referral.services.referral_service import ReferralService

                _service: Optional[ReferralService] = None


                def get_referral_service() -> ReferralService:
                    global _service
                    if _service is None:
                        _service = ReferralService(get_referral_strategies())
                    return _service


                def reset_referral_service() -> None:
                    global _service
                    _service = None
                """;
    }

    static String tasks() {
        return """
                \"""Background tasks for referral processing.\"""

                from app.core.celery_app import celery_app
                from app.core.database import async_session
                from app.referral.dependencies import get_referral_service


                @celery_app.task(bind=True, max_retries=3)
                def process_referral_event(self, event_type: str, user_id: str, payload: dict):
                    import asyncio

                    async def _run():
                        async with async_session() as session:
                            await get_referral_service().process_event(session, event_type, user_id, payload)

                    asyncio.run(_run())
                """;
    }

    static String schemasInit() {
        return """
                from app.referral.schemas.referral_schemas import (
                    ReferralCodeResponse,
                    ReferralListResponse,
                    ReferralResponse,
                    ReferralStats,
                )

                __all__ = ["ReferralCodeResponse", "ReferralListResponse", "ReferralResponse", "ReferralStats"]
                """;
    }

    static String schemas() {
        return """
                \"""Pydantic schemas for referral endpoints.\"""

                from datetime import datetime
                from typing import List, Optional
                from uuid import UUID

                from pydantic import BaseModel, ConfigDict

                from app.referral.models import ReferralStatus


                class ReferralResponse(BaseModel):
                    model_config = ConfigDict(from_attributes=True)

                    id: UUID
                    referred_user_id: UUID
                    referred_user_type: str
                    status: ReferralStatus
                    completed_at: Optional[datetime] = None
                    created_at: datetime


                class ReferralListResponse(BaseModel):
                    items: List[ReferralResponse]
                    total: int


                class ReferralStats(BaseModel):
                    total: int
                    pending: int
                    completed: int


                class ReferralCodeResponse(BaseModel):
                    referral_code: str
                """;
    }

    static String crudInit() {
        return """
                from app.referral.crud.referral_crud import referral_crud

                __all__ = ["referral_crud"]
                """;
    }

    static String crud() {
        return """
                \"""Database access for referrals.\"""

                from typing import List, Optional
                from uuid import UUID

                from sqlalchemy import func, select
                from sqlalchemy.ext.asyncio import AsyncSession

                from app.referral.models import Referral, ReferralStatus


                class ReferralCRUD:
                    async def get_by_referred_user(self, session: AsyncSession, user_id: UUID) -> Optional[Referral]:
                        result = await session.execute(select(Referral).where(Referral.referred_user_id == user_id))
                        return result.scalar_one_or_none()

                    async def list_by_referrer(
                        self, session: AsyncSession, referrer_id: UUID, skip: int = 0, limit: int = 50
                    ) -> List[Referral]:
                        result = await session.execute(
                            select(Referral).where(Referral.referrer_id == referrer_id).offset(skip).limit(limit)
                        )
                        return list(result.scalars().all())

                    async def count_by_status(self, session: AsyncSession, referrer_id: UUID, status: ReferralStatus) -> int:
                        result = await session.execute(
                            select(func.count()).where(Referral.referrer_id == referrer_id, Referral.status == status)
                        )
                        return result.scalar_one()


                referral_crud = ReferralCRUD()
                """;
    }

    static String servicesInit() {
        return """
                from app.referral.services.referral_service import ReferralService

                __all__ = ["ReferralService"]
                """;
    }

    static String service() {
        return """
                \"""Referral business logic: code generation and event processing.\"""

                import secrets
                import string
                from datetime import datetime, timezone
                from typing import Any, Dict
                from uuid import UUID

                from sqlalchemy.ext.asyncio import AsyncSession

                from app.referral.config import REFERRAL_CODE_LENGTH
                from app.referral.crud.referral_crud import referral_crud
                from app.referral.models import ReferralEvent, ReferralStatus
                from app.referral.strategies import ReferralCompletionStrategy


                class ReferralService:
                    def __init__(self, strategies: Dict[str, ReferralCompletionStrategy]):
                        self._strategies = strategies

                    @staticmethod
                    def generate_code() -> str:
                        alphabet = string.ascii_uppercase + string.digits
                        return "".join(secrets.choice(alphabet) for _ in range(REFERRAL_CODE_LENGTH))

                    async def process_event(
                        self, session: AsyncSession, event_type: str, user_id: UUID, payload: Dict[str, Any]
                    ) -> None:
                        referral = await referral_crud.get_by_referred_user(session, user_id)
                        if referral is None or referral.status != ReferralStatus.PENDING:
                            return
                        session.add(ReferralEvent(referral_id=referral.id, event_type=event_type, payload=payload))
                        strategy = self._strategies.get(referral.referred_user_type)
                        if strategy is not None and strategy.is_complete(event_type, payload):
                            referral.status = ReferralStatus.COMPLETED
                            referral.completed_at = datetime.now(timezone.utc)
                        await session.commit()
                """;
    }

    static String routesInit() {
        return """
                from app.referral.routes.referral_admin_routes import router as referral_admin_router
                from app.referral.routes.referral_routes import router as referral_router

                __all__ = ["referral_router", "referral_admin_router"]
                """;
    }

    static String routes() {
        return """
                \"""User-facing referral endpoints.\"""

                from fastapi import APIRouter, Depends
                from sqlalchemy.ext.asyncio import AsyncSession

                from app.core.database import get_session
                from app.referral.crud.referral_crud import referral_crud
                from app.referral.models import ReferralStatus
                from app.referral.schemas.referral_schemas import ReferralCodeResponse, ReferralListResponse, ReferralStats
                from app.user.dependencies import get_current_user

                router = APIRouter(prefix="/referrals", tags=["Referrals"])


                @router.get("/me/code", response_model=ReferralCodeResponse)
                async def get_my_referral_code(current_user=Depends(get_current_user)):
                    return ReferralCodeResponse(referral_code=current_user.referral_code)


                @router.get("/me/stats", response_model=ReferralStats)
                async def get_my_referral_stats(
                    session: AsyncSession = Depends(get_session), current_user=Depends(get_current_user)
                ):
                    pending = await referral_crud.count_by_status(session, current_user.id, ReferralStatus.PENDING)
                    completed = await referral_crud.count_by_status(session, current_user.id, ReferralStatus.COMPLETED)
                    return ReferralStats(total=pending + completed, pending=pending, completed=completed)


                @router.get("/me", response_model=ReferralListResponse)
                async def get_my_referrals(
                    skip: int = 0,
                    limit: int = 50,
                    session: AsyncSession = Depends(get_session),
                    current_user=Depends(get_current_user),
                ):
                    items = await referral_crud.list_by_referrer(session, current_user.id, skip, limit)
                    return ReferralListResponse(items=items, total=len(items))
                """;
    }

    static String adminRoutes() {
        return """
                \"""Admin referral endpoints.\"""

                from fastapi import APIRouter, Depends
                from sqlalchemy import func, select
                from sqlalchemy.ext.asyncio import AsyncSession

                from app.core.database import get_session
                from app.referral.models import Referral
                from app.user.dependencies import require_admin

                router = APIRouter(prefix="/admin/referrals", tags=["Admin - Referrals"],
                                   dependencies=[Depends(require_admin)])


                @router.get("/stats")
                async def get_system_stats(session: AsyncSession = Depends(get_session)):
                    result = await session.execute(select(Referral.status, func.count()).group_by(Referral.status))
                    return {status.value: count for status, count in result.all()}
                """;
    }
}
